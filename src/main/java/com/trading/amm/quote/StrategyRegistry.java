package com.trading.amm.quote;

import com.trading.amm.api.Address;
import com.trading.amm.api.PricingStrategy;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Maps strategy handles to implementations. */
public final class StrategyRegistry {
    private final Map<Address, PricingStrategy> strategies = new HashMap<>();

    public StrategyRegistry register(Address handle, PricingStrategy strategy) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(strategy, "strategy");
        if (handle.isZero())
            throw new ConfigurationException(ErrorCode.UNKNOWN_STRATEGY, "Strategy handle must be non-zero");
        strategies.put(handle, strategy);
        return this;
    }

    public boolean contains(Address handle) {
        return strategies.containsKey(handle);
    }

    public PricingStrategy get(Address handle) {
        PricingStrategy s = strategies.get(handle);
        if (s == null)
            throw new ConfigurationException(ErrorCode.UNKNOWN_STRATEGY, "No strategy registered for " + handle);
        return s;
    }
}
