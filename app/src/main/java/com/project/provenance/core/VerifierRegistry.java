package com.project.provenance.core;

import com.project.provenance.eth.Principal;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Principals allowed to correct authenticity scores outside the transfer path.
 * There is no revocation; a grant, once made, stays.
 */
public class VerifierRegistry {

    private final Map<Principal, VerifierGrant> grants = new ConcurrentHashMap<>();

    void authorize(LedgerTransaction tx, Principal verifier) {
        InputValidator.requireNonNull(verifier, "Verifier");
        if (!tx.callerIsRegistryOwner()) {
            throw new ProvenanceException(ProvenanceError.NOT_AUTHORIZED,
                    String.format("%s is not the registry owner", tx.caller()));
        }
        tx.stageGrant(new VerifierGrant(verifier, true));
    }

    /**
     * Absent principals are not verifiers.
     */
    public boolean isAuthorizedVerifier(Principal principal) {
        if (principal == null) {
            return false;
        }
        VerifierGrant grant = grants.get(principal);
        return grant != null && grant.authorized();
    }

    void put(VerifierGrant grant) {
        grants.put(grant.verifier(), grant);
    }
}
