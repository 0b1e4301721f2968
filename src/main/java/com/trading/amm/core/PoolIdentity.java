package com.trading.amm.core;

import com.trading.amm.api.Address;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

import java.util.HexFormat;

/**
 * Deterministic pool-identity derivation.
 *
 * {@code assemble(a, b, q, m) == assemble(b, a, q, m)} for every pair, and
 * {@code disassemble(assemble(a, b, q, m))} recovers the canonical
 * {@code (min, max, q, m)} exactly. Lookup correctness in every per-pool store
 * relies on both properties.
 */
public final class PoolIdentity {

    private PoolIdentity() {
        // Utility class
    }

    /**
     * Orders two assets canonically.
     *
     * @throws ConfigurationException if either asset is null or zero, or both are
     *                                the same
     */
    public static Address[] canonicalize(Address assetA, Address assetB) {
        if (assetA == null || assetB == null || assetA.isZero() || assetB.isZero())
            throw new ConfigurationException(ErrorCode.INVALID_ASSETS,
                    "Pool assets must be non-zero addresses: " + assetA + ", " + assetB);
        int cmp = assetA.compareTo(assetB);
        if (cmp == 0)
            throw new ConfigurationException(ErrorCode.IDENTICAL_ASSETS, "Pool assets are identical: " + assetA);
        return cmp < 0 ? new Address[] { assetA, assetB } : new Address[] { assetB, assetA };
    }

    public static PoolKey canonicalKey(Address assetA, Address assetB, Address strategy, int marking) {
        if (strategy == null || strategy.isZero())
            throw new ConfigurationException(ErrorCode.UNKNOWN_STRATEGY, "Strategy handle must be non-zero");
        Address[] ordered = canonicalize(assetA, assetB);
        return new PoolKey(ordered[0], ordered[1], strategy, marking & MarkingCodec.WORD_MASK);
    }

    public static PoolId assemble(Address assetA, Address assetB, Address strategy, int marking) {
        return assemble(canonicalKey(assetA, assetB, strategy, marking));
    }

    public static PoolId assemble(PoolKey key) {
        byte[] packed = new byte[PoolId.PACKED_LENGTH];
        System.arraycopy(key.asset0().toBytes(), 0, packed, 0, PoolId.ADDRESS_BYTES);
        System.arraycopy(key.asset1().toBytes(), 0, packed, PoolId.ADDRESS_BYTES, PoolId.ADDRESS_BYTES);
        System.arraycopy(key.strategy().toBytes(), 0, packed, PoolId.ADDRESS_BYTES * 2, PoolId.ADDRESS_BYTES);
        System.arraycopy(MarkingCodec.toBytes(key.marking()), 0, packed, PoolId.ADDRESS_BYTES * 3, 3);
        return new PoolId(packed);
    }

    public static PoolKey disassemble(PoolId id) {
        byte[] packed = id.raw();
        return new PoolKey(
                addressAt(packed, 0),
                addressAt(packed, PoolId.ADDRESS_BYTES),
                addressAt(packed, PoolId.ADDRESS_BYTES * 2),
                MarkingCodec.fromBytes(packed, PoolId.ADDRESS_BYTES * 3));
    }

    private static Address addressAt(byte[] packed, int offset) {
        return Address.of("0x" + HexFormat.of().formatHex(packed, offset, offset + PoolId.ADDRESS_BYTES));
    }
}
