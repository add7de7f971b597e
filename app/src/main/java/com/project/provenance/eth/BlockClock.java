package com.project.provenance.eth;

/**
 * Source of the host ledger's global clock (block height).
 * Successive reads never go backwards.
 */
public interface BlockClock {

    long currentHeight();
}
