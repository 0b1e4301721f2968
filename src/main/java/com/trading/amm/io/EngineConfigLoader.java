package com.trading.amm.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.amm.core.UintMath;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.mev.AtomicExecution;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and validates {@link EngineConfig} JSON documents. */
public final class EngineConfigLoader {
    private static final Logger log = LogManager.getLogger(EngineConfigLoader.class);
    public static final String DEFAULT_RESOURCE = "amm-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private EngineConfigLoader() {
        // Utility class
    }

    public static EngineConfig load(Path path) throws IOException {
        log.info("Loading engine configuration from {}", path);
        return parse(Files.readString(path));
    }

    /** Loads a classpath resource; a missing resource yields the defaults. */
    public static EngineConfig loadResource(String name) throws IOException {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                log.warn("Configuration resource {} not found, using defaults", name);
                return validate(new EngineConfig());
            }
            return validate(MAPPER.readValue(in, EngineConfig.class));
        }
    }

    public static EngineConfig parse(String json) throws IOException {
        return validate(MAPPER.readValue(json, EngineConfig.class));
    }

    /**
     * @throws ConfigurationException on a negative lock or window, a fee outside
     *                                [0, 10000] bps, or malformed batch windows
     */
    public static EngineConfig validate(EngineConfig config) {
        if (config.getPermanentLock() < 0)
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "permanentLock must be >= 0");
        if (config.getCommitRevealWindow() <= 0)
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "commitRevealWindow must be > 0");
        if (config.getBridgeErrorLogIntervalMillis() < 0)
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "bridgeErrorLogIntervalMillis must be >= 0");
        int bufferSize = config.getSequencerBufferSize();
        if (bufferSize <= 0 || Integer.bitCount(bufferSize) != 1)
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "sequencerBufferSize must be a power of 2");

        var fee = config.getProtocolFee();
        if (fee != null) {
            if (fee.getBps() < 0 || fee.getBps() > UintMath.BPS.intValue())
                throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "protocolFee.bps outside [0, 10000]");
            if (fee.getBps() > 0 && fee.getTreasury() == null)
                throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, "protocolFee.treasury required");
        }

        if (config.getBatchWindows() == null || config.getBatchWindows().size() != AtomicExecution.CONFIG_COUNT)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG,
                    "Exactly " + AtomicExecution.CONFIG_COUNT + " batch windows required");
        config.toBatchWindows(); // each window validates itself
        config.toProtocolFee();

        int em = config.getEmergencyBatchMode();
        if (em < 0 || em > AtomicExecution.CONFIG_COUNT)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG, "emergencyBatchMode outside 0..7");
        return config;
    }
}
