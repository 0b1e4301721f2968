package com.trading.amm.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trading.amm.api.Address;
import com.trading.amm.engine.ProtocolFeeConfig;
import com.trading.amm.mev.AtomicExecution;
import com.trading.amm.mev.BatchWindowConfig;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Engine configuration, bound from JSON by {@link EngineConfigLoader}.
 * Every field has a default, so an empty document is a valid configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    /** Shares burned forever on a pool's first deposit. */
    private long permanentLock = 1000;
    /** Blocks after the commit block during which a reveal is accepted. */
    private long commitRevealWindow = 256;
    private ProtocolFeeDef protocolFee = new ProtocolFeeDef();
    private List<BatchWindowDef> batchWindows = defaultWindows();
    private int emergencyBatchMode;
    private long bridgeErrorLogIntervalMillis = 1000;
    private int sequencerBufferSize = 1024;

    /** Protocol fee on pool profit. {@code bps == 0} disables it. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProtocolFeeDef {
        private String treasury;
        private int bps;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BatchWindowDef {
        private long cycleLength;
        private long settlementBlocks;
        private boolean enabled = true;

        public BatchWindowDef(long cycleLength, long settlementBlocks) {
            this.cycleLength = cycleLength;
            this.settlementBlocks = settlementBlocks;
        }
    }

    public List<BatchWindowConfig> toBatchWindows() {
        List<BatchWindowConfig> out = new ArrayList<>(batchWindows.size());
        for (BatchWindowDef d : batchWindows)
            out.add(new BatchWindowConfig(d.getCycleLength(), d.getSettlementBlocks(), d.isEnabled()));
        return out;
    }

    public ProtocolFeeConfig toProtocolFee() {
        if (protocolFee == null || protocolFee.getBps() == 0)
            return ProtocolFeeConfig.DISABLED;
        return ProtocolFeeConfig.of(Address.of(protocolFee.getTreasury()), protocolFee.getBps());
    }

    private static List<BatchWindowDef> defaultWindows() {
        List<BatchWindowDef> out = new ArrayList<>();
        for (BatchWindowConfig c : AtomicExecution.DEFAULT_CONFIGS)
            out.add(new BatchWindowDef(c.cycleLength(), c.settlementBlocks()));
        return out;
    }
}
