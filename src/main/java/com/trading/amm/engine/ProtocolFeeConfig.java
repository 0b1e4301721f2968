package com.trading.amm.engine;

import com.trading.amm.api.Address;
import com.trading.amm.core.UintMath;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

/** Protocol fee taken from pool profit at liquidity events. */
public record ProtocolFeeConfig(Address treasury, int bps) {
    public static final ProtocolFeeConfig DISABLED = new ProtocolFeeConfig(null, 0);

    public ProtocolFeeConfig {
        if (bps < 0 || bps > UintMath.BPS.intValue())
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "Protocol fee bps outside [0, 10000]: " + bps);
        if (bps > 0 && (treasury == null || treasury.isZero()))
            throw new ConfigurationException(ErrorCode.INVALID_ASSETS, "Protocol fee needs a treasury");
    }

    public static ProtocolFeeConfig of(Address treasury, int bps) {
        return bps == 0 ? DISABLED : new ProtocolFeeConfig(treasury, bps);
    }

    public boolean enabled() {
        return bps > 0;
    }
}
