package com.trading.amm.mev;

import com.trading.amm.api.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The swap a trader commits to ahead of execution.
 *
 * @param assetA     first asset, any order
 * @param assetB     second asset, any order
 * @param strategy   pool strategy handle
 * @param marking    24-bit pool marking
 * @param amountIn   amount sent in
 * @param zeroForOne direction relative to canonical asset order
 * @param minOut     slippage floor
 */
public record SwapIntent(Address assetA, Address assetB, Address strategy, int marking, BigInteger amountIn,
        boolean zeroForOne, BigInteger minOut) {

    public SwapIntent {
        Objects.requireNonNull(assetA, "assetA");
        Objects.requireNonNull(assetB, "assetB");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(amountIn, "amountIn");
        if (minOut == null)
            minOut = BigInteger.ZERO;
    }
}
