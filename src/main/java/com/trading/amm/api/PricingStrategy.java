package com.trading.amm.api;

import java.math.BigInteger;
import java.util.List;

/**
 * Pluggable pricing logic.
 *
 * A strategy receives the structured quote parameters (pair, direction, amount,
 * current pool inventory, decoded marking) plus the routed payload assembled from
 * the data bridges, and returns the output amount.
 *
 * Return Value Contract:
 * - A positive value is the amount the trader receives.
 * - Zero is the canonical "no price" signal; the engine turns it into
 * QuoteUnavailable. It is also the right answer when required bridge data is
 * missing.
 *
 * Strategies are invoked while the pool being priced is locked against
 * reentrant mutation, so calling back into the engine for the same pool fails.
 */
public interface PricingStrategy {

    BigInteger quote(QuoteParams params, RoutedPayload payload);

    /**
     * Prices several buckets of one pair in a single call.
     *
     * The default loops over {@link #quote}; strategies that share expensive
     * set-up across buckets should override it.
     */
    default BigInteger[] quoteBatch(List<QuoteParams> params, List<RoutedPayload> payloads) {
        if (params.size() != payloads.size())
            throw new IllegalArgumentException("params and payloads differ in size");
        BigInteger[] out = new BigInteger[params.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = quote(params.get(i), payloads.get(i));
        }
        return out;
    }
}
