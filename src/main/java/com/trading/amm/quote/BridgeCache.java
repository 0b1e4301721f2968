package com.trading.amm.quote;

import com.trading.amm.api.Address;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Bridge-response memo scoped to one logical call.
 *
 * Keyed by (bridge handle, canonical pair), so hops and buckets of the same pair
 * that share a bridge cost a single fetch. A fresh cache is created per
 * top-level operation; responses never leak across calls.
 *
 * Every caller receives its own copy of the response, so a strategy that
 * writes into its payload can not alter what later legs of the call see.
 */
public final class BridgeCache {
    private final Map<Key, byte[]> responses = new HashMap<>();
    private int fetchCount;

    public byte[] getOrFetch(Address handle, Address asset0, Address asset1, Supplier<byte[]> fetch) {
        Key key = new Key(handle, asset0, asset1);
        byte[] cached = responses.get(key);
        if (cached == null) {
            cached = fetch.get().clone();
            fetchCount++;
            responses.put(key, cached);
        }
        return cached.clone();
    }

    /** Number of bridge calls actually made through this cache. */
    public int fetchCount() {
        return fetchCount;
    }

    public int size() {
        return responses.size();
    }

    private record Key(Address handle, Address asset0, Address asset1) {
    }
}
