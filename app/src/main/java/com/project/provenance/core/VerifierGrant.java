package com.project.provenance.core;

import com.project.provenance.eth.Principal;

/**
 * Permission for a principal to correct authenticity scores by hand.
 */
public record VerifierGrant(Principal verifier, boolean authorized) {
}
