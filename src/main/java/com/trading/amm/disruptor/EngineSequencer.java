package com.trading.amm.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.amm.engine.PoolManager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Single-writer front end for a {@link PoolManager}.
 *
 * <p>
 * The pool manager is not thread-safe. This sequencer lets any number of
 * threads submit top-level calls; the LMAX Disruptor orders them and a single
 * consumer thread executes them one at a time, so no two calls ever observe
 * each other's partial state.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer claims a slot, fills an {@link EngineCommand} and
 * publishes it.</li>
 * <li>The consumer runs the command against the pool manager.</li>
 * <li>The command's future is completed with the result, or completed
 * exceptionally with the engine's exception (the call having been rolled
 * back).</li>
 * </ol>
 */
public final class EngineSequencer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(EngineSequencer.class);

    private final Disruptor<EngineCommand> disruptor;
    private final AtomicLong submitted = new AtomicLong();
    private final CommandHandler handler;
    private RingBuffer<EngineCommand> ringBuffer;

    public EngineSequencer(PoolManager manager, int bufferSize) {
        this.disruptor = new Disruptor<>(
                EngineCommand::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.handler = new CommandHandler(manager);
        disruptor.handleEventsWith(handler);
    }

    public synchronized EngineSequencer start() {
        if (ringBuffer == null) {
            ringBuffer = disruptor.start();
            log.info("Engine sequencer started (buffer {})", ringBuffer.getBufferSize());
        }
        return this;
    }

    /** Enqueues {@code work}; the future completes on the consumer thread. */
    public <T> CompletableFuture<T> submit(Function<PoolManager, T> work) {
        RingBuffer<EngineCommand> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Sequencer not started");
        CompletableFuture<T> future = new CompletableFuture<>();
        long sequence = rb.next();
        try {
            rb.get(sequence).set(work, future, submitted.incrementAndGet());
        } finally {
            rb.publish(sequence);
        }
        return future;
    }

    public long processedCount() {
        return handler.processed;
    }

    public long failedCount() {
        return handler.failed;
    }

    /** Drains pending commands, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (ringBuffer != null) {
            disruptor.shutdown();
            ringBuffer = null;
            log.info("Engine sequencer stopped after {} commands ({} failed)", handler.processed, handler.failed);
        }
    }

    private static final class CommandHandler implements EventHandler<EngineCommand> {
        private final PoolManager manager;
        private volatile long processed;
        private volatile long failed;

        CommandHandler(PoolManager manager) {
            this.manager = manager;
        }

        @Override
        public void onEvent(EngineCommand event, long sequence, boolean endOfBatch) {
            CompletableFuture<Object> result = event.result();
            try {
                Object value = event.work().apply(manager);
                processed++;
                result.complete(value);
            } catch (RuntimeException e) {
                processed++;
                failed++;
                log.debug("Command {} failed: {}", event.sequenceId(), e.toString());
                result.completeExceptionally(e);
            } finally {
                event.clear();
            }
        }
    }
}
