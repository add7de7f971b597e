package com.project.provenance.core;

import java.util.Objects;

/**
 * Thrown when a ledger call is rejected by one of its gates.
 * A call that throws this has applied no state change.
 */
public class ProvenanceException extends RuntimeException {

    private final ProvenanceError error;

    public ProvenanceException(ProvenanceError error, String message) {
        super(String.format("[%d %s] %s", error.code(), error.name(), message));
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public ProvenanceError error() {
        return error;
    }
}
