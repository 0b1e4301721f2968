package com.trading.amm.api;

/**
 * Pluggable market-data provider.
 *
 * Bridges are read-only and untrusted. The quote router treats any exception, a
 * {@code null} result or an empty array as "no data" and never lets a bridge
 * failure abort a quote; whether missing data makes pricing impossible is the
 * strategy's decision.
 */
@FunctionalInterface
public interface DataBridge {

    /**
     * Returns an opaque payload for the pair described by {@code context}.
     *
     * @param context the quote being priced (pair, amount, reserves, bucket)
     * @return encoded market data, or an empty array when none is available
     */
    byte[] getData(QuoteParams context);
}
