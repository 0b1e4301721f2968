package com.trading.amm.util;

import com.trading.amm.api.Address;
import com.trading.amm.api.EngineListener;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolKey;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts engine activity per pool.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Swaps:</b> number of swap legs and cumulative input and output
 * volume.</li>
 * <li><b>Liquidity:</b> add and remove events.</li>
 * <li><b>Sessions:</b> flash sessions settled.</li>
 * </ul>
 */
public final class StatsListener implements EngineListener {
    private final Map<PoolId, PoolStats> stats = new LinkedHashMap<>();
    private long poolsCreated;
    private long sessionsSettled;

    @Override
    public void onPoolCreated(PoolId poolId, PoolKey key) {
        poolsCreated++;
        stats.computeIfAbsent(poolId, id -> new PoolStats(key));
    }

    @Override
    public void onLiquidityAdded(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
        statsOf(poolId).liquidityEvents++;
    }

    @Override
    public void onLiquidityRemoved(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
        statsOf(poolId).liquidityEvents++;
    }

    @Override
    public void onSwap(PoolId poolId, Address beneficiary, boolean zeroForOne, BigInteger amountIn,
            BigInteger amountOut) {
        PoolStats s = statsOf(poolId);
        s.swaps++;
        s.volumeIn = s.volumeIn.add(amountIn);
        s.volumeOut = s.volumeOut.add(amountOut);
    }

    @Override
    public void onSessionSettled(Address owner, int tokensSettled) {
        sessionsSettled++;
    }

    public long poolsCreated() {
        return poolsCreated;
    }

    public long sessionsSettled() {
        return sessionsSettled;
    }

    public long swapCount(PoolId poolId) {
        PoolStats s = stats.get(poolId);
        return s == null ? 0 : s.swaps;
    }

    public BigInteger volumeIn(PoolId poolId) {
        PoolStats s = stats.get(poolId);
        return s == null ? BigInteger.ZERO : s.volumeIn;
    }

    public BigInteger volumeOut(PoolId poolId) {
        PoolStats s = stats.get(poolId);
        return s == null ? BigInteger.ZERO : s.volumeOut;
    }

    public void reset() {
        stats.clear();
        poolsCreated = 0;
        sessionsSettled = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-40s | %8s | %8s | %24s | %24s\n", "Pool", "Swaps", "LiqEvts", "Volume In",
                "Volume Out"));
        sb.append("------------------------------------------------------------------------------------------"
                + "------------------------------\n");
        for (PoolStats s : stats.values()) {
            String name = s.key == null ? "?" : s.key.asset0().hex().substring(0, 10) + "/"
                    + s.key.asset1().hex().substring(0, 10);
            sb.append(String.format("%-40s | %8d | %8d | %24s | %24s\n", name, s.swaps, s.liquidityEvents,
                    s.volumeIn, s.volumeOut));
        }
        return sb.toString();
    }

    private PoolStats statsOf(PoolId poolId) {
        return stats.computeIfAbsent(poolId, id -> new PoolStats(null));
    }

    private static final class PoolStats {
        final PoolKey key;
        long swaps;
        long liquidityEvents;
        BigInteger volumeIn = BigInteger.ZERO;
        BigInteger volumeOut = BigInteger.ZERO;

        PoolStats(PoolKey key) {
            this.key = key;
        }
    }
}
