package com.trading.amm.quote;

import com.trading.amm.api.Address;
import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.core.MarkingCodec;
import com.trading.amm.core.PoolIdentity;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.SessionException;
import com.trading.amm.util.ManualBlockClock;

import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class QuoteRouterTest {
    private static final Address A0 = Address.fromLong(0x10);
    private static final Address A1 = Address.fromLong(0x20);
    private static final Address STRATEGY = Address.fromLong(0x5EED);
    private static final Address ORACLE = Address.fromLong(0x0AC1E);
    private static final Address BROKEN = Address.fromLong(0xBAD);

    private StrategyRegistry strategies;
    private BridgeRegistry bridges;
    private ManualBlockClock clock;
    private QuoteRouter router;
    private final List<RoutedPayload> seen = new ArrayList<>();
    private BigInteger nextResult = BigInteger.valueOf(77);

    @Before
    public void setUp() {
        strategies = new StrategyRegistry();
        strategies.register(STRATEGY, (params, payload) -> {
            seen.add(payload);
            return nextResult;
        });
        bridges = new BridgeRegistry();
        clock = new ManualBlockClock(500, 1_700_000_000L).setGasPrice(30);
        router = new QuoteRouter(strategies, bridges, clock, 1000);
    }

    private static QuoteParams params(int marking) {
        return new QuoteParams(A0, A1, STRATEGY, BigInteger.TEN, BigInteger.valueOf(1000), BigInteger.valueOf(2000),
                MarkingCodec.decode(marking), true);
    }

    @Test
    public void testFailingBridgeYieldsEmptyData() {
        byte[] price = PriceData.of(2.0, 1).encode();
        bridges.setDefaultBridge(1, BROKEN, ctx -> {
            throw new IllegalStateException("feed offline");
        });
        bridges.setDefaultBridge(2, ORACLE, ctx -> price);
        bridges.setDefaultBridge(3, Address.fromLong(0x333), ctx -> new byte[] { 1 });

        Quote q = router.getQuote(params(0b0110), new BridgeCache(), false);

        assertEquals(BigInteger.valueOf(77), q.amountOut());
        assertEquals(PoolIdentity.assemble(A0, A1, STRATEGY, 0b0110), q.poolId());
        RoutedPayload payload = seen.get(0);
        assertEquals(0, payload.defaultData(0).length);
        assertEquals(0, payload.defaultData(1).length);
        assertArrayEquals(price, payload.defaultData(2));
        // not selected by the marking
        assertEquals(0, payload.defaultData(3).length);
        assertArrayEquals(price, payload.firstAvailable());
        assertFalse(payload.hasContext());
    }

    @Test
    public void testNullBridgeResponseIsEmpty() {
        bridges.setDefaultBridge(1, ORACLE, ctx -> null);
        RoutedPayload payload = router.route(params(0b0010), new BridgeCache(), false);
        assertNotNull(payload.defaultData(1));
        assertFalse(payload.hasData());
    }

    @Test
    public void testSameHandleFetchedOncePerCall() {
        AtomicInteger calls = new AtomicInteger();
        bridges.setDefaultBridge(1, ORACLE, ctx -> {
            calls.incrementAndGet();
            return new byte[] { 9 };
        });
        bridges.setDefaultBridge(2, ORACLE, ctx -> {
            calls.incrementAndGet();
            return new byte[] { 9 };
        });

        BridgeCache cache = new BridgeCache();
        router.getQuote(params(0b0110), cache, false);
        router.getQuote(params(MarkingCodec.compose(0b0110, 7, 0)), cache, false);

        assertEquals(1, calls.get());
        assertEquals(1, cache.fetchCount());

        // A fresh cache fetches again
        router.getQuote(params(0b0110), new BridgeCache(), false);
        assertEquals(2, calls.get());
    }

    @Test
    public void testStrategyWritesDoNotReachLaterLegs() {
        bridges.setDefaultBridge(1, ORACLE, ctx -> new byte[] { 9 });
        List<Byte> observed = new ArrayList<>();
        strategies.register(STRATEGY, (p, payload) -> {
            byte[] data = payload.defaultData(1);
            observed.add(data[0]);
            data[0] = 0;
            return BigInteger.ONE;
        });

        BridgeCache cache = new BridgeCache();
        router.getQuote(params(0b0010), cache, false);
        router.getQuote(params(MarkingCodec.compose(0b0010, 3, 0)), cache, false);

        assertEquals(List.of((byte) 9, (byte) 9), observed);
        assertEquals(1, cache.fetchCount());
    }

    @Test
    public void testEnhancedContext() {
        RoutedPayload payload = router.route(params(MarkingCodec.ENHANCED_CONTEXT_FLAG), new BridgeCache(), true);
        assertTrue(payload.hasContext());
        assertEquals(500, payload.context().blockNumber());
        assertEquals(1_700_000_000L, payload.context().timestamp());
        assertEquals(30, payload.context().gasPrice());
        assertTrue(payload.context().sessionActive());

        assertNull(router.route(params(0), new BridgeCache(), true).context());
    }

    @Test
    public void testExtraAndConsolidatedSlots() {
        bridges.setExtraBridge(3, Address.fromLong(0x3), ctx -> new byte[] { 3 });
        bridges.setConsolidatedBridge(Address.fromLong(0xF), ctx -> new byte[] { 15 });

        assertArrayEquals(new byte[] { 3 },
                router.route(params(MarkingCodec.compose(0, 0, 3)), new BridgeCache(), false).extra());
        assertArrayEquals(new byte[] { 15 },
                router.route(params(MarkingCodec.compose(0, 0, 15)), new BridgeCache(), false).extra());
        assertEquals(0, router.route(params(MarkingCodec.compose(0, 0, 4)), new BridgeCache(), false).extra().length);
    }

    @Test
    public void testInvalidSlotRejected() {
        try {
            bridges.setExtraBridge(15, ORACLE, ctx -> new byte[0]);
            fail("Slot 15 is the consolidated bridge");
        } catch (ConfigurationException e) {
            assertEquals(ErrorCode.INVALID_BRIDGE_SLOT, e.code());
        }
    }

    @Test
    public void testNegativeOrNullResultMeansNoPrice() {
        nextResult = BigInteger.valueOf(-5);
        assertFalse(router.getQuote(params(0), new BridgeCache(), false).isAvailable());
        nextResult = null;
        assertEquals(BigInteger.ZERO, router.getQuote(params(0), new BridgeCache(), false).amountOut());
    }

    @Test
    public void testFailingStrategyMeansNoPrice() {
        strategies.register(STRATEGY, (p, payload) -> {
            throw new ArithmeticException("model diverged");
        });
        assertFalse(router.getQuote(params(0), new BridgeCache(), false).isAvailable());

        BigInteger[] batch = router.getQuoteBatch(List.of(params(0), params(0x10)), new BridgeCache(), false);
        assertArrayEquals(new BigInteger[] { BigInteger.ZERO, BigInteger.ZERO }, batch);
    }

    @Test
    public void testEngineErrorsFromStrategyPropagate() {
        strategies.register(STRATEGY, (p, payload) -> {
            throw new SessionException(ErrorCode.REENTRANT_CALL, "blocked");
        });
        try {
            router.getQuote(params(0), new BridgeCache(), false);
            fail("Engine errors are not a missing price");
        } catch (SessionException e) {
            assertEquals(ErrorCode.REENTRANT_CALL, e.code());
        }
    }

    @Test
    public void testExplicitReservesOverride() {
        List<QuoteParams> captured = new ArrayList<>();
        PricingStrategy capture = (p, payload) -> {
            captured.add(p);
            return BigInteger.ONE;
        };
        strategies.register(STRATEGY, capture);
        router.getQuote(params(0), BigInteger.valueOf(5), BigInteger.valueOf(6), new BridgeCache(), false);
        assertEquals(BigInteger.valueOf(5), captured.get(0).reserve0());
        assertEquals(BigInteger.valueOf(6), captured.get(0).reserve1());
    }

    @Test
    public void testBatchSharesBridgeFetches() {
        AtomicInteger calls = new AtomicInteger();
        bridges.setDefaultBridge(1, ORACLE, ctx -> {
            calls.incrementAndGet();
            return PriceData.of(1.5, 1).encode();
        });
        BridgeCache cache = new BridgeCache();
        BigInteger[] out = router.getQuoteBatch(List.of(
                params(MarkingCodec.compose(0b0010, 1, 0)),
                params(MarkingCodec.compose(0b0010, 2, 0)),
                params(MarkingCodec.compose(0b0010, 3, 0))), cache, false);

        assertEquals(3, out.length);
        assertEquals(1, calls.get());
        assertEquals(3, seen.size());
    }

    @Test
    public void testBatchRejectsMixedPairs() {
        QuoteParams other = new QuoteParams(A0, Address.fromLong(0x30), STRATEGY, BigInteger.ONE, null, null,
                MarkingCodec.decode(0), true);
        try {
            router.getQuoteBatch(List.of(params(0), other), new BridgeCache(), false);
            fail("Mixed pairs are not a batch");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testUnknownStrategy() {
        QuoteParams p = new QuoteParams(A0, A1, Address.fromLong(0x999), BigInteger.ONE, null, null,
                MarkingCodec.decode(0), true);
        try {
            router.getQuote(p, new BridgeCache(), false);
            fail("No such strategy");
        } catch (ConfigurationException e) {
            assertEquals(ErrorCode.UNKNOWN_STRATEGY, e.code());
        }
    }
}
