package com.project.provenance.eth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Per-network ledger settings: registry owner, network name and optional JSON-RPC endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerConfig {

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("network")
    private String network;

    @JsonProperty("rpcUrl")
    private String rpcUrl;

    public LedgerConfig() {
    }

    public LedgerConfig(String owner, String network, String rpcUrl) {
        this.owner = owner;
        this.network = network;
        this.rpcUrl = rpcUrl;
    }

    /**
     * Registry owner, the only principal allowed to register models and grant verifiers.
     */
    public Principal owner() {
        if (owner == null || owner.isBlank()) {
            throw new IllegalStateException("Ledger config for network '" + network + "' has no owner");
        }
        return Principal.of(owner);
    }

    public boolean hasOwner() {
        return owner != null && !owner.isBlank();
    }

    public String network() {
        return network;
    }

    public Optional<String> rpcUrl() {
        return rpcUrl == null || rpcUrl.isBlank() ? Optional.empty() : Optional.of(rpcUrl);
    }
}
