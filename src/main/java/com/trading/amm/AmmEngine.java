package com.trading.amm;

import com.trading.amm.api.Address;
import com.trading.amm.api.BlockContext;
import com.trading.amm.api.DataBridge;
import com.trading.amm.api.EngineListener;
import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.TokenTransfers;
import com.trading.amm.core.StateJournal;
import com.trading.amm.disruptor.EngineSequencer;
import com.trading.amm.engine.PoolManager;
import com.trading.amm.io.EngineConfig;
import com.trading.amm.io.EngineConfigLoader;
import com.trading.amm.io.JsonSnapshotSerializer;
import com.trading.amm.mev.ProtectionPolicy;
import com.trading.amm.quote.BridgeRegistry;
import com.trading.amm.quote.StrategyRegistry;
import com.trading.amm.util.CompositeEngineListener;
import com.trading.amm.util.InMemoryTokenVault;
import com.trading.amm.util.ManualBlockClock;
import com.trading.amm.util.StatsListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A high-level wrapper that wires a {@link PoolManager} from configuration and
 * collaborators.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading {@link EngineConfig} from JSON</li>
 * <li>Registering strategies and data bridges</li>
 * <li>Sharing one {@link StateJournal} between the engine and a journal-aware
 * vault</li>
 * <li>Optionally running calls through an {@link EngineSequencer}</li>
 * </ul>
 * Without explicit transfers or a block context the builder falls back to an
 * {@link InMemoryTokenVault} and a {@link ManualBlockClock}, which suits
 * simulations.
 */
public final class AmmEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(AmmEngine.class);

    /** Custody account of the default in-memory vault. */
    public static final Address DEFAULT_CUSTODY = Address.fromLong(0xA4400L);

    private final EngineConfig config;
    private final PoolManager manager;
    private final StateJournal journal;
    private final TokenTransfers transfers;
    private final BlockContext block;
    private final CompositeEngineListener listeners;
    private EngineSequencer sequencer;

    private AmmEngine(Builder b) {
        this.config = b.config;
        this.journal = b.journal;
        this.transfers = b.transfers != null ? b.transfers : new InMemoryTokenVault(journal, DEFAULT_CUSTODY);
        this.block = b.block != null ? b.block : new ManualBlockClock();
        this.listeners = b.listeners;
        this.manager = new PoolManager(config, journal, b.strategies, b.bridges, transfers, block, b.policy,
                listeners);
        log.info("AMM engine ready: lock={}, revealWindow={}, fee={}", config.getPermanentLock(),
                config.getCommitRevealWindow(), manager.protocolFee());
    }

    public static Builder builder() {
        return new Builder();
    }

    public PoolManager manager() {
        return manager;
    }

    public EngineConfig config() {
        return config;
    }

    public StateJournal journal() {
        return journal;
    }

    public TokenTransfers transfers() {
        return transfers;
    }

    /** The in-memory vault, when the engine was built without explicit transfers. */
    public InMemoryTokenVault vault() {
        if (transfers instanceof InMemoryTokenVault v)
            return v;
        throw new IllegalStateException("Engine uses external token transfers");
    }

    public BlockContext blockContext() {
        return block;
    }

    /**
     * Adds a listener alongside the ones registered at build time.
     */
    public void addListener(EngineListener listener) {
        listeners.add(listener);
    }

    /** Enables per-pool activity counters. Use the returned listener to dump them. */
    public StatsListener enableStats() {
        var stats = new StatsListener();
        listeners.add(stats);
        return stats;
    }

    /** Starts (once) and returns the single-writer command sequencer. */
    public synchronized EngineSequencer sequencer() {
        if (sequencer == null)
            sequencer = new EngineSequencer(manager, config.getSequencerBufferSize()).start();
        return sequencer;
    }

    public String snapshotJson() {
        return new JsonSnapshotSerializer(true).toJson(manager, block.blockNumber());
    }

    @Override
    public synchronized void close() {
        if (sequencer != null) {
            sequencer.close();
            sequencer = null;
        }
    }

    /** Fluent builder; every collaborator is optional. */
    public static final class Builder {
        private EngineConfig config = new EngineConfig();
        private StateJournal journal = new StateJournal();
        private final StrategyRegistry strategies = new StrategyRegistry();
        private final BridgeRegistry bridges = new BridgeRegistry();
        private final CompositeEngineListener listeners = new CompositeEngineListener();
        private TokenTransfers transfers;
        private BlockContext block;
        private ProtectionPolicy policy = ProtectionPolicy.ALLOW_ALL;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = EngineConfigLoader.validate(config);
            return this;
        }

        public Builder config(Path path) throws IOException {
            this.config = EngineConfigLoader.load(path);
            return this;
        }

        /** Journal shared with journal-aware collaborators such as an external vault. */
        public Builder journal(StateJournal journal) {
            this.journal = journal;
            return this;
        }

        public Builder transfers(TokenTransfers transfers) {
            this.transfers = transfers;
            return this;
        }

        public Builder blockContext(BlockContext block) {
            this.block = block;
            return this;
        }

        public Builder strategy(Address handle, PricingStrategy strategy) {
            strategies.register(handle, strategy);
            return this;
        }

        public Builder defaultBridge(int index, Address handle, DataBridge bridge) {
            bridges.setDefaultBridge(index, handle, bridge);
            return this;
        }

        public Builder extraBridge(int slot, Address handle, DataBridge bridge) {
            bridges.setExtraBridge(slot, handle, bridge);
            return this;
        }

        public Builder consolidatedBridge(Address handle, DataBridge bridge) {
            bridges.setConsolidatedBridge(handle, bridge);
            return this;
        }

        public Builder protectionPolicy(ProtectionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder listener(EngineListener listener) {
            listeners.add(listener);
            return this;
        }

        public AmmEngine build() {
            return new AmmEngine(this);
        }
    }
}
