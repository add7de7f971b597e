package com.project.provenance.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Keccak-256 verification hashes for transfer records.
 *
 * The ledger stores whatever hash the caller supplies; these helpers let a
 * caller derive one from the asset content and check it later.
 */
public final class VerificationHashes {

    private VerificationHashes() {
    }

    /**
     * @return keccak-256 of {@code content} as 64 lower-case hex characters, no prefix.
     */
    public static String keccakHex(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        return Numeric.toHexStringNoPrefix(Hash.sha3(content));
    }

    public static String keccakHex(String content) {
        Objects.requireNonNull(content, "content must not be null");
        return keccakHex(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Recompute the hash of {@code content} and compare, ignoring case and a {@code 0x} prefix.
     */
    public static boolean matches(String hash, byte[] content) {
        if (hash == null || content == null) {
            return false;
        }
        String normalized = Numeric.cleanHexPrefix(hash.trim()).toLowerCase(Locale.ROOT);
        return normalized.equals(keccakHex(content));
    }
}
