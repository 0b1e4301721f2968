package com.trading.amm.util;

import com.trading.amm.api.Address;
import com.trading.amm.api.TokenTransfers;
import com.trading.amm.core.StateJournal;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.SessionException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fungible balances held in memory, with one custody account standing for the
 * engine.
 *
 * Writes go through the shared {@link StateJournal}, so transfers made during
 * an engine call are undone with the rest of the call when it fails.
 */
public final class InMemoryTokenVault implements TokenTransfers {
    private final StateJournal journal;
    private final Address custody;
    private final Map<Holding, BigInteger> balances = new HashMap<>();

    public InMemoryTokenVault(StateJournal journal, Address custody) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.custody = Objects.requireNonNull(custody, "custody");
    }

    public Address custody() {
        return custody;
    }

    public void mint(Address owner, Address token, BigInteger amount) {
        if (amount.signum() < 0)
            throw new IllegalArgumentException("Negative mint");
        credit(owner, token, amount);
    }

    public BigInteger balanceOf(Address owner, Address token) {
        return balances.getOrDefault(new Holding(owner, token), BigInteger.ZERO);
    }

    public BigInteger custodyBalance(Address token) {
        return balanceOf(custody, token);
    }

    @Override
    public void pull(Address from, Address token, BigInteger amount) {
        move(from, custody, token, amount);
    }

    @Override
    public void push(Address to, Address token, BigInteger amount) {
        move(custody, to, token, amount);
    }

    private void move(Address from, Address to, Address token, BigInteger amount) {
        if (amount.signum() < 0)
            throw new IllegalArgumentException("Negative transfer");
        BigInteger held = balanceOf(from, token);
        if (held.compareTo(amount) < 0)
            throw new SessionException(ErrorCode.INSUFFICIENT_FUNDS,
                    from + " holds " + held + " of " + token + ", needs " + amount);
        journal.put(balances, new Holding(from, token), held.subtract(amount));
        credit(to, token, amount);
    }

    private void credit(Address owner, Address token, BigInteger amount) {
        Holding h = new Holding(owner, token);
        journal.put(balances, h, balances.getOrDefault(h, BigInteger.ZERO).add(amount));
    }

    private record Holding(Address owner, Address token) {
    }
}
