package com.project.provenance.eth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.provenance.core.InputValidator.InvalidInputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves ledger configuration from {@code <dir>/<network>.json} and the environment.
 *
 * Environment variables win over the file:
 * <ul>
 *   <li>{@value #NETWORK_ENV} selects the network (default {@value #DEFAULT_NETWORK});</li>
 *   <li>{@value #OWNER_ENV} sets the registry owner;</li>
 *   <li>{@value #RPC_URL_ENV} sets the JSON-RPC endpoint backing the block clock.</li>
 * </ul>
 * An owner that is not a valid principal is rejected when the config is resolved,
 * not when the ledger first needs it.
 */
public class LedgerConfigRegistry {

    public static final String NETWORK_ENV = "PROVENANCE_NETWORK";
    public static final String OWNER_ENV = "PROVENANCE_OWNER";
    public static final String RPC_URL_ENV = "ETH_RPC_URL";
    public static final String DEFAULT_NETWORK = "localhost";

    private final Path configDirectory;
    private final Map<String, String> environment;
    private final ObjectMapper mapper = new ObjectMapper();

    public LedgerConfigRegistry(Path configDirectory) {
        this(configDirectory, Map.of());
    }

    public LedgerConfigRegistry(Path configDirectory, Map<String, String> environment) {
        this.configDirectory = Objects.requireNonNull(configDirectory, "configDirectory must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * Read the config file of a network, without environment overrides.
     *
     * @return empty if the network has no config file
     * @throws IllegalStateException if the file is unreadable or names an invalid owner
     */
    public Optional<LedgerConfig> load(String networkName) {
        Path file = configDirectory.resolve(networkName + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        LedgerConfig config;
        try {
            config = mapper.readValue(file.toFile(), LedgerConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config: " + file, e);
        }
        if (config.hasOwner()) {
            requireValidOwner(config, file.toString());
        }
        return Optional.of(config);
    }

    /**
     * Config for the network selected by the environment, with overrides applied.
     *
     * @param defaultOwner owner used when neither the file nor the environment names one
     */
    public LedgerConfig resolve(Principal defaultOwner) {
        Objects.requireNonNull(defaultOwner, "defaultOwner must not be null");
        String network = env(NETWORK_ENV).orElse(DEFAULT_NETWORK);
        Optional<LedgerConfig> fromFile = load(network);

        String owner = env(OWNER_ENV)
                .or(() -> fromFile.filter(LedgerConfig::hasOwner).map(config -> config.owner().address()))
                .orElse(defaultOwner.address());
        String rpcUrl = env(RPC_URL_ENV)
                .or(() -> fromFile.flatMap(LedgerConfig::rpcUrl))
                .orElse(null);

        LedgerConfig resolved = new LedgerConfig(owner, network, rpcUrl);
        requireValidOwner(resolved, OWNER_ENV);
        return resolved;
    }

    private Optional<String> env(String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static void requireValidOwner(LedgerConfig config, String source) {
        try {
            config.owner();
        } catch (InvalidInputException e) {
            throw new IllegalStateException("Invalid registry owner in " + source + ": " + e.getMessage(), e);
        }
    }
}
