package com.trading.amm.core;

import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.LiquidityException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-pool inventory and share-supply store.
 *
 * Reserve Packing:
 * Both reserves live in a single 256-bit word, {@code reserve1 << 128 |
 * reserve0}. They are always read and written together as one logical unit, so a
 * half-applied update can never be observed.
 *
 * Contract:
 * {@link #applyDelta} records signed deltas and never clamps. Callers validate
 * sufficiency beforehand; a delta that would drive a reserve negative or past
 * u128 is a caller bug and fails loudly instead of being adjusted.
 *
 * All writes go through the {@link StateJournal}, so they are undone when the
 * enclosing top-level call fails.
 */
public final class InventoryLedger {
    private static final int HALF = 128;

    private final StateJournal journal;
    private final Map<PoolId, BigInteger> packedReserves = new HashMap<>();
    private final Map<PoolId, BigInteger> totalShares = new HashMap<>();
    private final Map<PoolId, Reserves> feeBaseline = new HashMap<>();

    public InventoryLedger(StateJournal journal) {
        this.journal = journal;
    }

    /** Current reserves; {@code (0, 0)} for pools that never held liquidity. */
    public Reserves getInventory(PoolId poolId) {
        return unpack(packedReserves.getOrDefault(poolId, BigInteger.ZERO));
    }

    public PoolState getPoolState(PoolId poolId) {
        Reserves r = getInventory(poolId);
        Reserves base = feeBaseline.getOrDefault(poolId, Reserves.ZERO);
        return new PoolState(r.reserve0(), r.reserve1(),
                totalShares.getOrDefault(poolId, BigInteger.ZERO),
                base.reserve0(), base.reserve1());
    }

    /**
     * Applies signed reserve deltas in canonical asset order.
     *
     * @throws LiquidityException {@code INSUFFICIENT_RESERVES} if a reserve would
     *                            go negative, {@code RESERVE_OVERFLOW} if it
     *                            would exceed u128
     */
    public Reserves applyDelta(PoolId poolId, BigInteger delta0, BigInteger delta1) {
        Reserves current = getInventory(poolId);
        BigInteger r0 = current.reserve0().add(delta0);
        BigInteger r1 = current.reserve1().add(delta1);
        if (r0.signum() < 0 || r1.signum() < 0)
            throw new LiquidityException(ErrorCode.INSUFFICIENT_RESERVES,
                    "Delta (" + delta0 + ", " + delta1 + ") exceeds reserves of " + poolId);
        if (!UintMath.fitsU128(r0) || !UintMath.fitsU128(r1))
            throw new LiquidityException(ErrorCode.RESERVE_OVERFLOW, "Reserve exceeds u128 in " + poolId);
        Reserves next = new Reserves(r0, r1);
        journal.put(packedReserves, poolId, pack(next));
        return next;
    }

    public void setTotalShares(PoolId poolId, BigInteger shares) {
        if (shares.signum() < 0)
            throw new IllegalArgumentException("Negative share supply");
        journal.put(totalShares, poolId, shares);
    }

    /** Records the reserves whose ratio prices the next protocol-fee check. */
    public void setProtocolFeeBaseline(PoolId poolId, Reserves baseline) {
        journal.put(feeBaseline, poolId, baseline);
    }

    static BigInteger pack(Reserves r) {
        return r.reserve1().shiftLeft(HALF).or(r.reserve0());
    }

    static Reserves unpack(BigInteger word) {
        return new Reserves(word.and(UintMath.U128_MAX), word.shiftRight(HALF));
    }

    /** Reserve pair in canonical asset order. */
    public record Reserves(BigInteger reserve0, BigInteger reserve1) {
        public static final Reserves ZERO = new Reserves(BigInteger.ZERO, BigInteger.ZERO);

        public boolean isEmpty() {
            return reserve0.signum() == 0 && reserve1.signum() == 0;
        }
    }
}
