package com.trading.amm.disruptor;

import com.trading.amm.engine.PoolManager;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A mutable ring-buffer slot carrying one top-level engine call.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the ring buffer is
 * built and reused for every command; {@link #clear()} drops references once
 * the command has run so completed work is not retained.
 */
public final class EngineCommand {
    private Function<PoolManager, ?> work;
    private CompletableFuture<Object> result;
    private long sequenceId;

    @SuppressWarnings("unchecked")
    public void set(Function<PoolManager, ?> work, CompletableFuture<?> result, long seqId) {
        this.work = work;
        this.result = (CompletableFuture<Object>) result;
        this.sequenceId = seqId;
    }

    public Function<PoolManager, ?> work() {
        return work;
    }

    public CompletableFuture<Object> result() {
        return result;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        work = null;
        result = null;
        sequenceId = 0;
    }
}
