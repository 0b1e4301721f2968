package com.trading.amm.io;

import com.trading.amm.EngineFixture;
import com.trading.amm.core.PoolId;
import com.trading.amm.mev.PoolFeature;

import org.junit.Test;

import java.util.EnumSet;
import java.util.List;

import static com.trading.amm.EngineFixture.*;
import static org.junit.Assert.*;

public class JsonSnapshotSerializerTest {

    @Test
    public void testSnapshotContents() throws Exception {
        EngineFixture fx = new EngineFixture();
        PoolId id = fx.seedWethUsdc(0x12, units(1000), units(130_000));
        fx.pm.configurePoolFeatures(id, EnumSet.of(PoolFeature.CIRCUIT_BREAKER));
        fx.pm.createPool(LP, USDC, DAI, CPMM, 0);

        JsonSnapshotSerializer serializer = new JsonSnapshotSerializer();
        String json = serializer.toJson(fx.pm, 100);
        assertTrue(json.contains("\"reserve0\""));

        PoolSnapshot snap = serializer.fromJson(json);
        assertEquals(100, snap.getBlockNumber());
        assertEquals(2, snap.getPools().size());

        PoolSnapshot.PoolEntry e = snap.getPools().get(0);
        assertEquals("0x" + id.digest().toString(16), e.getDigest());
        assertEquals(WETH.hex(), e.getAsset0());
        assertEquals("0x000012", e.getMarking());
        assertEquals(units(1000), e.getReserve0());
        assertEquals(units(130_000), e.getReserve1());
        assertEquals(fx.pm.getPoolState(id).totalShares(), e.getTotalShares());
        assertEquals(List.of("CIRCUIT_BREAKER"), e.getFeatures());

        // Empty pool, no features
        PoolSnapshot.PoolEntry empty = snap.getPools().get(1);
        assertEquals(USDC.hex(), empty.getAsset0());
        assertNull(empty.getFeatures());
    }

    @Test
    public void testEngineSnapshotIsPretty() {
        EngineFixture fx = new EngineFixture();
        fx.seedWethUsdc(0, units(10), units(1300));
        String json = fx.engine.snapshotJson();
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"blockNumber\" : 100"));
    }
}
