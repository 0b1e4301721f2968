package com.trading.amm.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * Undo journal giving every top-level engine call all-or-nothing semantics.
 *
 * All mutable stores (inventory, shares, sessions, commitments, token vaults)
 * route their writes through {@link #put} / {@link #remove} or register an
 * explicit undo action with {@link #record}. {@link #atomically} opens a
 * (possibly nested) transaction: on any exception every write made inside it is
 * reverted in reverse order before the exception propagates. Writes made outside
 * a transaction are applied without journaling.
 *
 * Thread Safety:
 * Not thread-safe. The engine is a single-writer component; concurrent callers
 * go through {@link com.trading.amm.disruptor.EngineSequencer}.
 */
@Log4j2
public final class StateJournal {
    private final Deque<Runnable> undo = new ArrayDeque<>();
    private int depth;

    public <T> T atomically(Supplier<T> work) {
        int mark = undo.size();
        depth++;
        boolean ok = false;
        try {
            T result = work.get();
            ok = true;
            return result;
        } finally {
            depth--;
            if (!ok) {
                int reverted = rollbackTo(mark);
                log.debug("Rolled back {} journaled writes", reverted);
            } else if (depth == 0) {
                undo.clear();
            }
        }
    }

    public void atomicallyRun(Runnable work) {
        atomically(() -> {
            work.run();
            return null;
        });
    }

    public boolean inTransaction() {
        return depth > 0;
    }

    /** Registers an undo action for a write the caller has just applied. */
    public void record(Runnable undoAction) {
        if (depth > 0)
            undo.push(undoAction);
    }

    /** Journaled {@code map.put}. Returns the previous value. */
    public <K, V> V put(Map<K, V> map, K key, V value) {
        boolean existed = map.containsKey(key);
        V previous = map.put(key, value);
        record(() -> restore(map, key, existed, previous));
        return previous;
    }

    /** Journaled {@code map.remove}. Returns the removed value. */
    public <K, V> V remove(Map<K, V> map, K key) {
        if (!map.containsKey(key))
            return null;
        V previous = map.remove(key);
        record(() -> map.put(key, previous));
        return previous;
    }

    int pendingWrites() {
        return undo.size();
    }

    private static <K, V> void restore(Map<K, V> map, K key, boolean existed, V previous) {
        if (existed)
            map.put(key, previous);
        else
            map.remove(key);
    }

    private int rollbackTo(int mark) {
        int n = 0;
        while (undo.size() > mark) {
            undo.pop().run();
            n++;
        }
        return n;
    }
}
