package com.trading.amm.api;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A 20-byte account / asset / component handle, rendered as {@code 0x} plus 40
 * lowercase hex digits.
 *
 * Natural ordering is numeric, which for the fixed-width lowercase form is the
 * same as lexicographic string order. Pool identity depends on this ordering
 * being total and stable.
 */
public record Address(String hex) implements Comparable<Address> {
    private static final Pattern FORMAT = Pattern.compile("0x[0-9a-f]{40}");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    /** Handle used for the chain's native value in settlement. */
    public static final Address NATIVE = ZERO;

    public Address {
        Objects.requireNonNull(hex, "hex");
        hex = hex.toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(hex).matches())
            throw new IllegalArgumentException("Malformed address: " + hex);
    }

    public static Address of(String hex) {
        return new Address(hex);
    }

    /** Builds an address whose low 8 bytes hold {@code value}. Handy for fixtures. */
    public static Address fromLong(long value) {
        return new Address(String.format("0x%040x", value));
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    /** Raw 20-byte big-endian form. */
    public byte[] toBytes() {
        byte[] out = new byte[20];
        for (int i = 0; i < 20; i++) {
            out[i] = (byte) Integer.parseInt(hex.substring(2 + i * 2, 4 + i * 2), 16);
        }
        return out;
    }

    @Override
    public int compareTo(Address other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
