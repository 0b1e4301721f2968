package com.trading.amm.core;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Packed pool identifier.
 *
 * Layout (63 bytes): {@code asset0[20] | asset1[20] | strategy[20] |
 * marking[3]}, assets in canonical order. The packing is lossless, so the id is
 * both the lookup key of every per-pool store and a faithful carrier of the
 * pool's coordinates ({@link PoolIdentity#disassemble}).
 *
 * {@link #digest()} is the 256-bit SHA3-256 hash of the packed bytes, the
 * compact numeric id exposed to external integrators.
 */
public final class PoolId {
    static final int ADDRESS_BYTES = 20;
    static final int PACKED_LENGTH = ADDRESS_BYTES * 3 + 3;

    private final byte[] packed;
    private final int hash;
    private BigInteger digest;

    PoolId(byte[] packed) {
        if (packed.length != PACKED_LENGTH)
            throw new IllegalArgumentException("Packed pool id must be " + PACKED_LENGTH + " bytes");
        this.packed = packed.clone();
        this.hash = Arrays.hashCode(this.packed);
    }

    /** Copy of the packed representation. */
    public byte[] toBytes() {
        return packed.clone();
    }

    byte[] raw() {
        return packed;
    }

    public BigInteger digest() {
        BigInteger d = digest;
        if (d == null) {
            d = new BigInteger(1, sha3(packed));
            digest = d;
        }
        return d;
    }

    public String toHex() {
        return "0x" + HexFormat.of().formatHex(packed);
    }

    static byte[] sha3(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA3-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA3-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PoolId other))
            return false;
        return hash == other.hash && Arrays.equals(packed, other.packed);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "PoolId[" + PoolIdentity.disassemble(this) + "]";
    }
}
