package com.project.provenance.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes provenance reports as JSON files, one per asset.
 */
public class ProvenanceReportWriter {

    private final Path outputDirectory;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ProvenanceReportWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path write(ProvenanceReport report) throws IOException {
        Files.createDirectories(outputDirectory);

        Path target = outputDirectory.resolve(fileName(report));
        Files.writeString(
                target,
                mapper.writeValueAsString(report),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
        );
        return target;
    }

    static String fileName(ProvenanceReport report) {
        return "asset-" + report.record().assetId() + ".json";
    }
}
