package com.trading.amm.core;

import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.SessionException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reentrancy guard keyed per logical resource.
 *
 * A scope is acquired before a mutate-then-call-out sequence on a resource (a
 * pool id, a session owner) and released on every exit path through
 * try-with-resources. Holding the key of pool A does not block work on pool B,
 * which keeps legitimate nesting (a flash callback swapping on several pools)
 * possible while an untrusted strategy or bridge calling back into the same pool
 * is rejected with {@code REENTRANT_CALL}.
 */
public final class ReentrancyGuard {
    private final Set<Object> held = new HashSet<>();

    public Scope enter(Object resource) {
        if (!held.add(resource))
            throw new SessionException(ErrorCode.REENTRANT_CALL, "Reentrant call on " + resource);
        return () -> held.remove(resource);
    }

    public boolean isHeld(Object resource) {
        return held.contains(resource);
    }

    /** Releases the guarded resource. Never throws. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
