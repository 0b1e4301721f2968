package com.trading.amm.api;

import java.util.Collections;
import java.util.List;

/**
 * Market data gathered for one quote.
 *
 * {@code defaults} always has one entry per default bridge slot; an unselected
 * or failed bridge contributes an empty array, never {@code null}. {@code extra}
 * is the payload of the configurable or consolidated bridge (empty when none).
 * {@code context} is only present when the pool's marking sets the
 * enhanced-context flag.
 */
public record RoutedPayload(List<byte[]> defaults, byte[] extra, TraderContext context) {
    private static final byte[] NONE = new byte[0];

    public static final RoutedPayload EMPTY = new RoutedPayload(
            List.of(NONE, NONE, NONE, NONE), NONE, null);

    public RoutedPayload {
        defaults = defaults == null ? List.of() : Collections.unmodifiableList(defaults);
        if (extra == null)
            extra = NONE;
    }

    public byte[] defaultData(int index) {
        if (index < 0 || index >= defaults.size())
            return NONE;
        byte[] d = defaults.get(index);
        return d == null ? NONE : d;
    }

    /** First non-empty default payload, else the extra payload, else empty. */
    public byte[] firstAvailable() {
        for (byte[] d : defaults) {
            if (d != null && d.length > 0)
                return d;
        }
        return extra;
    }

    public boolean hasData() {
        return firstAvailable().length > 0;
    }

    public boolean hasContext() {
        return context != null;
    }
}
