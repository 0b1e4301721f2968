package com.trading.amm.io;

import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** JSON view of the engine's pools at one block. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PoolSnapshot {
    private long blockNumber;
    private List<PoolEntry> pools;

    /** Coordinates and accounting of a single pool. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PoolEntry {
        private String digest;
        private String asset0, asset1, strategy, marking;
        private BigInteger reserve0, reserve1, totalShares, feeBaseline0, feeBaseline1;
        private List<String> features;
    }
}
