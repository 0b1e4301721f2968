package com.trading.amm.mev;

/** Pool-level opt-in for the policy-driven protection modules. */
public enum PoolFeature {
    ACCESS_CONTROL,
    CIRCUIT_BREAKER,
    VOLUME_CONTROL
}
