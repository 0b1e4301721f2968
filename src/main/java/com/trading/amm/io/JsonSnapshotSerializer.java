package com.trading.amm.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trading.amm.core.MarkingCodec;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolKey;
import com.trading.amm.core.PoolState;
import com.trading.amm.engine.PoolManager;
import com.trading.amm.mev.PoolFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Exports the state of every registered pool as JSON, for inspection and
 * offline reconciliation. Read-only: a snapshot is never loaded back into an
 * engine.
 */
public final class JsonSnapshotSerializer {
    private final ObjectMapper mapper;

    public JsonSnapshotSerializer() {
        this(false);
    }

    public JsonSnapshotSerializer(boolean pretty) {
        this.mapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public PoolSnapshot snapshot(PoolManager manager, long blockNumber) {
        List<PoolSnapshot.PoolEntry> entries = new ArrayList<>();
        for (PoolId id : manager.poolIds()) {
            PoolKey key = manager.poolKey(id);
            PoolState state = manager.getPoolState(id);
            PoolSnapshot.PoolEntry e = new PoolSnapshot.PoolEntry();
            e.setDigest("0x" + id.digest().toString(16));
            e.setAsset0(key.asset0().hex());
            e.setAsset1(key.asset1().hex());
            e.setStrategy(key.strategy().hex());
            e.setMarking(MarkingCodec.toHex(key.marking()));
            e.setReserve0(state.reserve0());
            e.setReserve1(state.reserve1());
            e.setTotalShares(state.totalShares());
            e.setFeeBaseline0(state.feeBaseline0());
            e.setFeeBaseline1(state.feeBaseline1());
            List<String> features = new ArrayList<>();
            for (PoolFeature f : manager.poolFeatures(id))
                features.add(f.name());
            e.setFeatures(features.isEmpty() ? null : features);
            entries.add(e);
        }
        PoolSnapshot snapshot = new PoolSnapshot();
        snapshot.setBlockNumber(blockNumber);
        snapshot.setPools(entries);
        return snapshot;
    }

    public String toJson(PoolManager manager, long blockNumber) {
        try {
            return mapper.writeValueAsString(snapshot(manager, blockNumber));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pool snapshot", e);
        }
    }

    public PoolSnapshot fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, PoolSnapshot.class);
    }
}
