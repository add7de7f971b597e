package com.project.provenance.core;

/**
 * Symbolic failure kinds raised by the provenance ledger.
 *
 * Each kind keeps a stable numeric code so rejections can be reported the same
 * way the on-chain registry reports them.
 */
public enum ProvenanceError {
    NOT_AUTHORIZED(100, "caller lacks the required role"),
    NFT_NOT_FOUND(101, "asset does not exist"),
    ALREADY_REGISTERED(102, "identifier is already registered"),
    INVALID_AUTHENTICITY_SCORE(103, "score or confidence level out of range"),
    TRANSFER_FAILED(104, "transfer blocked by fraud detection"),
    INVALID_AI_MODEL(105, "AI model is missing or inactive"),
    // Reserved: no operation raises this yet.
    PROVENANCE_NOT_FOUND(106, "provenance record not found");

    private final int code;
    private final String description;

    ProvenanceError(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
