package com.project.provenance.eth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.project.provenance.core.InputValidator.InvalidInputException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.util.Locale;

/**
 * Authenticated identity on the host ledger: a 20-byte account address.
 *
 * @param address lower-case, {@code 0x}-prefixed hex form of the address.
 */
public record Principal(String address) {

    public Principal {
        if (address == null) {
            throw new InvalidInputException("Principal address must not be null");
        }
        String trimmed = address.trim();
        if (!WalletUtils.isValidAddress(trimmed)) {
            throw new InvalidInputException(
                String.format("Principal has invalid address format: '%s'. Expected 0x followed by 40 hex digits", address)
            );
        }
        address = "0x" + Numeric.cleanHexPrefix(trimmed).toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Principal of(String address) {
        return new Principal(address);
    }

    /**
     * EIP-55 mixed-case rendering, used wherever a principal is displayed or exported.
     */
    @JsonValue
    public String checksumAddress() {
        return Keys.toChecksumAddress(address);
    }

    @Override
    public String toString() {
        return checksumAddress();
    }
}
