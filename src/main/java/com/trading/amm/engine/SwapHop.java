package com.trading.amm.engine;

import com.trading.amm.api.Address;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * One hop of a batch swap.
 *
 * A hop with a single marking routes its whole input through that pool. With
 * several markings the input fans out across the bucket variants of the pair:
 * on the first hop {@code amounts} are absolute and must sum to the batch input;
 * on later hops they are weights applied to the previous hop's output (equal
 * weights when empty).
 *
 * @param zeroForOne direction relative to canonical asset order
 */
public record SwapHop(Address assetA, Address assetB, Address strategy, List<Integer> markings,
        List<BigInteger> amounts, boolean zeroForOne) {

    public SwapHop {
        Objects.requireNonNull(assetA, "assetA");
        Objects.requireNonNull(assetB, "assetB");
        Objects.requireNonNull(strategy, "strategy");
        if (markings == null || hasNull(markings))
            throw new ConfigurationException(ErrorCode.INVALID_HOP, "Hop markings must be non-null");
        if (amounts != null && hasNull(amounts))
            throw new ConfigurationException(ErrorCode.INVALID_HOP, "Hop amounts must be non-null");
        markings = List.copyOf(markings);
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
    }

    public static SwapHop single(Address assetA, Address assetB, Address strategy, int marking, boolean zeroForOne) {
        return new SwapHop(assetA, assetB, strategy, List.of(marking), List.of(), zeroForOne);
    }

    public boolean isSplit() {
        return markings.size() > 1;
    }

    private static boolean hasNull(List<?> values) {
        for (Object v : values) {
            if (v == null)
                return true;
        }
        return false;
    }
}
