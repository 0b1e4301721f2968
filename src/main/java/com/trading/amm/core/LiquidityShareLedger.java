package com.trading.amm.core;

import com.trading.amm.api.Address;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.LiquidityException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/** Liquidity-share balances per (pool, owner). Journaled. */
public final class LiquidityShareLedger {
    private final StateJournal journal;
    private final Map<Holding, BigInteger> balances = new HashMap<>();

    public LiquidityShareLedger(StateJournal journal) {
        this.journal = journal;
    }

    public BigInteger balanceOf(PoolId poolId, Address owner) {
        return balances.getOrDefault(new Holding(poolId, owner), BigInteger.ZERO);
    }

    public void credit(PoolId poolId, Address owner, BigInteger shares) {
        Holding h = new Holding(poolId, owner);
        journal.put(balances, h, balances.getOrDefault(h, BigInteger.ZERO).add(shares));
    }

    public void debit(PoolId poolId, Address owner, BigInteger shares) {
        Holding h = new Holding(poolId, owner);
        BigInteger held = balances.getOrDefault(h, BigInteger.ZERO);
        if (held.compareTo(shares) < 0)
            throw new LiquidityException(ErrorCode.INSUFFICIENT_SHARES,
                    owner + " holds " + held + " shares, requested " + shares);
        BigInteger left = held.subtract(shares);
        if (left.signum() == 0)
            journal.remove(balances, h);
        else
            journal.put(balances, h, left);
    }

    private record Holding(PoolId poolId, Address owner) {
    }
}
