package com.trading.amm.api;

import com.trading.amm.core.Marking;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Structured input handed to data bridges and pricing strategies.
 *
 * Assets are in canonical order; {@code zeroForOne} is relative to that order.
 * Reserves are the pool's inventory at the moment of the quote.
 *
 * @param asset0     canonical lower asset
 * @param asset1     canonical upper asset
 * @param strategy   strategy handle of the pool
 * @param amountIn   amount the trader sends in
 * @param reserve0   current inventory of asset0
 * @param reserve1   current inventory of asset1
 * @param marking    decoded marking word (bucket, bridges, flags)
 * @param zeroForOne true when trading asset0 for asset1
 */
public record QuoteParams(Address asset0, Address asset1, Address strategy, BigInteger amountIn,
        BigInteger reserve0, BigInteger reserve1, Marking marking, boolean zeroForOne) {

    public QuoteParams {
        Objects.requireNonNull(asset0, "asset0");
        Objects.requireNonNull(asset1, "asset1");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(amountIn, "amountIn");
        Objects.requireNonNull(marking, "marking");
        if (reserve0 == null)
            reserve0 = BigInteger.ZERO;
        if (reserve1 == null)
            reserve1 = BigInteger.ZERO;
    }

    public QuoteParams withReserves(BigInteger r0, BigInteger r1) {
        return new QuoteParams(asset0, asset1, strategy, amountIn, r0, r1, marking, zeroForOne);
    }

    public QuoteParams withAmountIn(BigInteger amount) {
        return new QuoteParams(asset0, asset1, strategy, amount, reserve0, reserve1, marking, zeroForOne);
    }

    public QuoteParams withMarking(Marking m) {
        return new QuoteParams(asset0, asset1, strategy, amountIn, reserve0, reserve1, m, zeroForOne);
    }

    public int bucketId() {
        return marking.bucketId();
    }

    public BigInteger reserveIn() {
        return zeroForOne ? reserve0 : reserve1;
    }

    public BigInteger reserveOut() {
        return zeroForOne ? reserve1 : reserve0;
    }
}
