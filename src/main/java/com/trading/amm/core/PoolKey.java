package com.trading.amm.core;

import com.trading.amm.api.Address;

import java.util.Objects;

/**
 * Canonical, structured pool coordinates: {@code asset0 < asset1}, the pricing
 * strategy handle and the 24-bit marking word.
 *
 * Instances are only valid in canonical order; use
 * {@link PoolIdentity#canonicalKey} to build one from caller-ordered assets.
 */
public record PoolKey(Address asset0, Address asset1, Address strategy, int marking) {

    public PoolKey {
        Objects.requireNonNull(asset0, "asset0");
        Objects.requireNonNull(asset1, "asset1");
        Objects.requireNonNull(strategy, "strategy");
        if (asset0.compareTo(asset1) >= 0)
            throw new IllegalArgumentException("Assets not in canonical order: " + asset0 + ", " + asset1);
        if ((marking & ~MarkingCodec.WORD_MASK) != 0)
            throw new IllegalArgumentException("Marking wider than 24 bits: " + marking);
    }

    public Marking decodedMarking() {
        return MarkingCodec.decode(marking);
    }

    /** Token sent in by a trade in the given canonical direction. */
    public Address tokenIn(boolean zeroForOne) {
        return zeroForOne ? asset0 : asset1;
    }

    public Address tokenOut(boolean zeroForOne) {
        return zeroForOne ? asset1 : asset0;
    }

    @Override
    public String toString() {
        return asset0 + "/" + asset1 + "@" + strategy + "#" + MarkingCodec.toHex(marking);
    }
}
