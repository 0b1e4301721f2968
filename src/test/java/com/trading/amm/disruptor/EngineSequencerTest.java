package com.trading.amm.disruptor;

import com.trading.amm.EngineFixture;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolState;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.SessionException;
import com.trading.amm.util.StatsListener;

import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.trading.amm.EngineFixture.*;
import static org.junit.Assert.*;

public class EngineSequencerTest {

    @Test
    public void testConcurrentSubmittersAreSerialised() throws Exception {
        EngineFixture fx = new EngineFixture();
        StatsListener stats = fx.engine.enableStats();
        PoolId id = fx.seedWethUsdc(0, units(1000), units(130_000));
        fx.fund(ALICE, WETH, units(100));
        fx.fund(BOB, USDC, units(100_000));

        EngineSequencer seq = fx.engine.sequencer();
        int perThread = 25;
        List<CompletableFuture<BigInteger>> futures = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final boolean sellWeth = t % 2 == 0;
            Thread th = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    futures.add(seq.submit(pm -> sellWeth
                            ? pm.swap(ALICE, WETH, USDC, CPMM, 0, units(1), true, BigInteger.ZERO)
                            : pm.swap(BOB, USDC, WETH, CPMM, 0, units(100), false, BigInteger.ZERO)));
                }
            });
            threads.add(th);
            th.start();
        }
        start.countDown();
        for (Thread th : threads)
            th.join();
        for (CompletableFuture<BigInteger> f : futures)
            assertTrue(f.get(10, TimeUnit.SECONDS).signum() > 0);

        assertEquals(100, stats.swapCount(id));
        assertEquals(100, seq.processedCount());
        assertEquals(0, seq.failedCount());

        PoolState s = seq.submit(pm -> pm.getPoolState(id)).get(10, TimeUnit.SECONDS);
        assertEquals(fx.vault.custodyBalance(WETH), s.reserve0());
        assertEquals(fx.vault.custodyBalance(USDC), s.reserve1());
        fx.engine.close();
    }

    @Test
    public void testFailureCompletesExceptionally() throws Exception {
        EngineFixture fx = new EngineFixture();
        fx.seedWethUsdc(0, units(1000), units(130_000));

        try (EngineSequencer seq = new EngineSequencer(fx.pm, 64).start()) {
            CompletableFuture<BigInteger> f = seq.submit(
                    pm -> pm.swap(ALICE, WETH, USDC, CPMM, 0, units(1), true, BigInteger.ZERO));
            try {
                f.get(10, TimeUnit.SECONDS);
                fail("Alice holds no WETH");
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof SessionException);
                assertEquals(ErrorCode.INSUFFICIENT_FUNDS, ((SessionException) e.getCause()).code());
            }

            // The consumer keeps going after a failure
            fx.fund(ALICE, WETH, units(1));
            assertTrue(seq.submit(pm -> pm.swap(ALICE, WETH, USDC, CPMM, 0, units(1), true, BigInteger.ZERO))
                    .get(10, TimeUnit.SECONDS).signum() > 0);
            assertEquals(1, seq.failedCount());
        }
    }

    @Test
    public void testSubmitBeforeStartRejected() {
        EngineFixture fx = new EngineFixture();
        EngineSequencer seq = new EngineSequencer(fx.pm, 8);
        try {
            seq.submit(pm -> pm.poolIds());
            fail("Not started");
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
