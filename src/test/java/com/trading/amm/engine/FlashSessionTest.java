package com.trading.amm.engine;

import com.trading.amm.EngineFixture;
import com.trading.amm.api.Address;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolState;
import com.trading.amm.error.AmmException;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;
import com.trading.amm.error.SessionException;
import com.trading.amm.mev.TraderProtection;
import com.trading.amm.util.StatsListener;

import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.trading.amm.EngineFixture.*;
import static org.junit.Assert.*;

public class FlashSessionTest {
    private EngineFixture fx;
    private PoolManager pm;
    private PoolId pool;

    @Before
    public void setUp() {
        fx = new EngineFixture();
        pm = fx.pm;
        pool = fx.seedWethUsdc(0, units(1000), units(130_000));
        fx.fund(ALICE, WETH, units(10));
    }

    @Test
    public void testRoundTripNetsToSingleTransfer() {
        StatsListener stats = fx.engine.enableStats();
        BigInteger[] firstOut = new BigInteger[1];

        Map<Address, BigInteger> settled = pm.flashSession(ALICE, (m, owner, data) -> {
            firstOut[0] = m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, BigInteger.ZERO);

            // Deferred: nothing moved yet
            assertEquals(units(-1), m.pendingDelta(owner, WETH));
            assertEquals(firstOut[0], m.pendingDelta(owner, USDC));
            assertEquals(units(10), fx.balance(owner, WETH));
            assertTrue(m.isSessionActive(owner));

            m.swap(owner, USDC, WETH, CPMM, 0, firstOut[0], false, BigInteger.ZERO);
        }, null, List.of(WETH, USDC));

        // USDC netted to zero, only WETH moved
        assertEquals(1, settled.size());
        BigInteger wethDelta = settled.get(WETH);
        assertTrue(wethDelta.signum() < 0);
        assertTrue(wethDelta.negate().compareTo(units(1).divide(BigInteger.valueOf(50))) < 0);
        assertEquals(units(10).add(wethDelta), fx.balance(ALICE, WETH));
        assertEquals(BigInteger.ZERO, fx.balance(ALICE, USDC));

        assertFalse(pm.isSessionActive(ALICE));
        assertEquals(2, stats.swapCount(pool));
        assertEquals(1, stats.sessionsSettled());

        PoolState s = pm.getPoolState(pool);
        assertEquals(fx.vault.custodyBalance(WETH), s.reserve0());
        assertEquals(fx.vault.custodyBalance(USDC), s.reserve1());
    }

    @Test
    public void testSessionCoversTemporaryShortfall() {
        // Alice has no USDC: she sells first, then spends the proceeds before settling
        Map<Address, BigInteger> settled = pm.flashSession(ALICE, (m, owner, data) -> {
            BigInteger usdc = m.swap(owner, WETH, USDC, CPMM, 0, units(2), true, BigInteger.ZERO);
            m.swap(owner, USDC, WETH, CPMM, 0, usdc.divide(BigInteger.TWO), false, BigInteger.ZERO);
        }, new byte[] { 1 }, List.of(USDC, WETH));

        assertTrue(settled.get(WETH).signum() < 0);
        assertTrue(settled.get(USDC).signum() > 0);
        assertEquals(settled.get(USDC), fx.balance(ALICE, USDC));
    }

    @Test
    public void testOmittedTokenRollsBackSession() {
        PoolState before = pm.getPoolState(pool);
        try {
            pm.flashSession(ALICE, (m, owner, data) -> m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null),
                    null, List.of(WETH));
            fail("USDC left unsettled");
        } catch (SessionException e) {
            assertEquals(ErrorCode.UNSETTLED_DELTAS, e.code());
        }

        assertEquals(before, pm.getPoolState(pool));
        assertEquals(units(10), fx.balance(ALICE, WETH));
        assertFalse(pm.isSessionActive(ALICE));
        assertEquals(BigInteger.ZERO, pm.pendingDelta(ALICE, USDC));
    }

    @Test
    public void testCallbackFailureRollsBack() {
        try {
            pm.flashSession(ALICE, (m, owner, data) -> {
                m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null);
                throw new IllegalStateException("callback gave up");
            }, null, List.of(WETH, USDC));
            fail("Callback failure propagates");
        } catch (IllegalStateException e) {
            assertEquals("callback gave up", e.getMessage());
        }
        assertFalse(pm.isSessionActive(ALICE));
        assertEquals(units(1000), pm.getPoolState(pool).reserve0());
    }

    @Test
    public void testNestedSessionForSameOwnerRejected() {
        try {
            pm.flashSession(ALICE, (m, owner, data) -> m.flashSession(owner, (m2, o2, d2) -> {
            }, null, List.of()), null, List.of());
            fail("Nested start for the same owner");
        } catch (SessionException e) {
            assertEquals(ErrorCode.SESSION_ALREADY_ACTIVE, e.code());
        }
        assertFalse(pm.isSessionActive(ALICE));
    }

    @Test
    public void testNestedSessionOfAnotherOwner() {
        fx.fund(BOB, WETH, units(5));

        pm.flashSession(ALICE, (m, owner, data) -> {
            m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null);
            m.flashSession(BOB, (m2, bob, d2) -> {
                m2.swap(bob, WETH, USDC, CPMM, 0, units(2), true, null);
                assertTrue(m2.pendingDelta(bob, WETH).signum() < 0);
            }, null, List.of(WETH, USDC));

            // Back in Alice's session: her next trade is still hers
            m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null);
            assertEquals(units(-2), m.pendingDelta(owner, WETH));
        }, null, List.of(WETH, USDC));

        assertEquals(units(8), fx.balance(ALICE, WETH));
        assertEquals(units(3), fx.balance(BOB, WETH));
        assertTrue(fx.balance(BOB, USDC).signum() > 0);
    }

    @Test
    public void testLiquidityInsideSession() {
        fx.fund(ALICE, USDC, units(1000));
        pm.flashSession(ALICE, (m, owner, data) -> {
            LiquidityResult r = m.addLiquidity(owner, WETH, USDC, CPMM, 0, units(1), units(130));
            m.removeLiquidity(owner, WETH, USDC, CPMM, 0, r.shares());
        }, null, List.of(WETH, USDC));

        // Rounding may keep a dust amount in the pool, never the other way round
        assertTrue(fx.balance(ALICE, WETH).compareTo(units(10)) <= 0);
        assertTrue(fx.balance(ALICE, WETH).compareTo(units(10).subtract(BigInteger.valueOf(1_000_000))) > 0);
    }

    @Test
    public void testNativeValueRefunded() {
        fx.fund(ALICE, Address.NATIVE, BigInteger.valueOf(500));
        Map<Address, BigInteger> settled = pm.flashSession(ALICE, (m, owner, data) -> {
            assertEquals(BigInteger.ZERO, fx.balance(owner, Address.NATIVE));
        }, null, List.of(), BigInteger.valueOf(500));

        assertEquals(BigInteger.valueOf(500), settled.get(Address.NATIVE));
        assertEquals(BigInteger.valueOf(500), fx.balance(ALICE, Address.NATIVE));
    }

    @Test
    public void testAtomicSwapNeedsSession() {
        int atomic = TraderProtection.atomicWord(0);
        try {
            pm.swapWithProtection(ALICE, WETH, USDC, CPMM, 0, units(1), true, null, atomic);
            fail("Atomic swap outside a session");
        } catch (MevProtectionException e) {
            assertEquals(ErrorCode.ATOMIC_EXECUTION_REQUIRED, e.code());
        }

        pm.flashSession(ALICE, (m, owner, data) -> m.swapWithProtection(owner, WETH, USDC, CPMM, 0, units(1), true,
                null, atomic), null, List.of(WETH, USDC));
        assertEquals(units(9), fx.balance(ALICE, WETH));
    }

    @Test
    public void testEmergencyModeGatesPlainSwaps() {
        pm.setEmergencyBatchMode(1); // (2, 1): even blocks only
        fx.clock.setBlockNumber(101);
        try {
            pm.swap(ALICE, WETH, USDC, CPMM, 0, units(1), true, null);
            fail("Emergency mode requires a session");
        } catch (AmmException e) {
            assertEquals(ErrorCode.ATOMIC_EXECUTION_REQUIRED, e.code());
        }
        try {
            pm.flashSession(ALICE, (m, owner, data) -> m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null),
                    null, List.of(WETH, USDC));
            fail("Odd block is outside the window");
        } catch (AmmException e) {
            assertEquals(ErrorCode.OUTSIDE_BATCH_WINDOW, e.code());
        }

        fx.clock.advance(1);
        pm.flashSession(ALICE, (m, owner, data) -> m.swap(owner, WETH, USDC, CPMM, 0, units(1), true, null),
                null, List.of(WETH, USDC));
        assertEquals(units(9), fx.balance(ALICE, WETH));
    }
}
