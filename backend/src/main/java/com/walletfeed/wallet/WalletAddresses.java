package com.walletfeed.wallet;

import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * EIP-55 helpers. Wallet identity is always the checksummed form.
 */
public final class WalletAddresses {

    private WalletAddresses() {
    }

    public static boolean isValid(String address) {
        return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
    }

    /**
     * Returns the checksummed form of any-case hex address.
     *
     * @throws IllegalArgumentException when the value is not a 20-byte hex address
     */
    public static String toChecksum(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid wallet address: " + address);
        }
        return Keys.toChecksumAddress(address.toLowerCase(Locale.ROOT));
    }

    public static boolean isChecksummed(String address) {
        return isValid(address) && toChecksum(address).equals(address);
    }

    public static String requireChecksummed(String address) {
        if (!isChecksummed(address)) {
            throw new IllegalArgumentException("Wallet address must be checksummed: " + address);
        }
        return address;
    }

    /**
     * Case-insensitive comparison; null never matches.
     */
    public static boolean sameAddress(String left, String right) {
        return left != null && right != null && left.equalsIgnoreCase(right);
    }
}
