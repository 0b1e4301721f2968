package com.trading.amm.session;

import com.trading.amm.api.Address;
import com.trading.amm.api.TokenTransfers;
import com.trading.amm.core.StateJournal;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.SessionException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Transient per-owner delta ledger with deferred settlement.
 *
 * Sign Convention:
 * A positive delta is owed by the engine to the user, a negative one is owed by
 * the user to the engine. {@link #addDelta} always accumulates.
 *
 * Lifecycle:
 * <ol>
 * <li>{@link #startSession} marks the owner active. A second start for the same
 * owner fails with {@code SESSION_ALREADY_ACTIVE}.</li>
 * <li>While active, {@link #isSessionActive} is true and every other component
 * defers settlement into this ledger.</li>
 * <li>{@link #settle} moves each listed token's net delta through
 * {@link TokenTransfers} and zeroes it. Settling an already-zero delta is a
 * no-op, so a second settle never pays twice.</li>
 * <li>{@link #endSession} fails with {@code UNSETTLED_DELTAS} if any token touched
 * during the session still carries a nonzero delta.</li>
 * </ol>
 *
 * The active-user slot names the beneficiary of nested operations so inner
 * calls need not re-pass it. All state is journaled.
 */
@Log4j2
public final class FlashAccountingSession {
    private final StateJournal journal;
    private final Set<Address> activeOwners = new HashSet<>();
    private final Map<DeltaKey, BigInteger> deltas = new LinkedHashMap<>();
    private Address activeUser;

    public FlashAccountingSession(StateJournal journal) {
        this.journal = journal;
    }

    public void startSession(Address owner) {
        Objects.requireNonNull(owner, "owner");
        if (!activeOwners.add(owner))
            throw new SessionException(ErrorCode.SESSION_ALREADY_ACTIVE, "Session already active for " + owner);
        journal.record(() -> activeOwners.remove(owner));
        log.debug("Session opened for {}", owner);
    }

    public boolean isSessionActive(Address user) {
        return user != null && activeOwners.contains(user);
    }

    public void setActiveUser(Address user) {
        Address previous = activeUser;
        activeUser = user;
        journal.record(() -> activeUser = previous);
    }

    /** Beneficiary of pending operations, or {@code null} outside any session. */
    public Address getActiveUser() {
        return activeUser;
    }

    public void clearActiveUser() {
        setActiveUser(null);
    }

    public void addDelta(Address user, Address token, BigInteger amount) {
        if (amount.signum() == 0)
            return;
        DeltaKey key = new DeltaKey(user, token);
        BigInteger next = deltas.getOrDefault(key, BigInteger.ZERO).add(amount);
        if (next.signum() == 0)
            journal.remove(deltas, key);
        else
            journal.put(deltas, key, next);
    }

    public BigInteger getDelta(Address user, Address token) {
        return deltas.getOrDefault(new DeltaKey(user, token), BigInteger.ZERO);
    }

    /** Tokens with a nonzero pending delta for {@code user}, in first-touched order. */
    public List<Address> unsettledTokens(Address user) {
        List<Address> out = new ArrayList<>();
        for (DeltaKey k : deltas.keySet()) {
            if (k.user().equals(user))
                out.add(k.token());
        }
        return out;
    }

    /**
     * Settles the listed tokens for {@code user}.
     *
     * Native value the user already placed in custody ({@code nativeSupplied}) is
     * netted against the {@link Address#NATIVE} delta: it covers what the user
     * owes first, and any surplus is refunded. When the native token is not
     * listed the whole supplied amount is refunded.
     *
     * @return the transfers made, keyed by token; positive amounts were paid to
     *         the user, negative ones were pulled from the user
     */
    public Map<Address, BigInteger> settle(Address user, Collection<Address> tokens, BigInteger nativeSupplied,
            TokenTransfers transfers) {
        BigInteger supplied = nativeSupplied == null ? BigInteger.ZERO : nativeSupplied;
        if (supplied.signum() < 0)
            throw new IllegalArgumentException("Negative native value");

        Map<Address, BigInteger> moved = new LinkedHashMap<>();
        Set<Address> unique = new LinkedHashSet<>(tokens);
        boolean nativeHandled = false;

        for (Address token : unique) {
            BigInteger net = getDelta(user, token);
            if (token.equals(Address.NATIVE)) {
                net = net.add(supplied);
                nativeHandled = true;
            }
            if (net.signum() == 0) {
                journal.remove(deltas, new DeltaKey(user, token));
                continue;
            }
            if (net.signum() > 0)
                transfers.push(user, token, net);
            else
                transfers.pull(user, token, net.negate());
            journal.remove(deltas, new DeltaKey(user, token));
            moved.put(token, net);
        }

        if (!nativeHandled && supplied.signum() > 0) {
            transfers.push(user, Address.NATIVE, supplied);
            moved.put(Address.NATIVE, supplied);
        }
        if (!moved.isEmpty())
            log.debug("Settled {} token(s) for {}", moved.size(), user);
        return Collections.unmodifiableMap(moved);
    }

    public void endSession(Address owner) {
        if (!activeOwners.contains(owner))
            throw new SessionException(ErrorCode.SESSION_NOT_ACTIVE, "No active session for " + owner);
        List<Address> residual = unsettledTokens(owner);
        if (!residual.isEmpty())
            throw new SessionException(ErrorCode.UNSETTLED_DELTAS,
                    "Session for " + owner + " ends with unsettled tokens " + residual);
        activeOwners.remove(owner);
        journal.record(() -> activeOwners.add(owner));
        log.debug("Session closed for {}", owner);
    }

    private record DeltaKey(Address user, Address token) {
    }
}
