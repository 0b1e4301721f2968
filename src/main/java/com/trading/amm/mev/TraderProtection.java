package com.trading.amm.mev;

/**
 * Decoded 32-bit trader protection word.
 *
 * <pre>
 * bits 0-1   access-control mode
 * bits 2-3   circuit-breaker mode
 * bits 4-5   volume-control mode
 * bits 6-7   reserved
 * bit  8     atomic execution
 * bits 9-11  batch mode (0 = session only, 1-7 = batch window config)
 * bits 12-31 reserved
 * </pre>
 *
 * Reserved bits are ignored on decode and written as zero on encode.
 */
public record TraderProtection(int accessMode, int circuitMode, int volumeMode, boolean atomic, int batchMode) {
    static final int MODE_MASK = 0x3;
    static final int CIRCUIT_SHIFT = 2;
    static final int VOLUME_SHIFT = 4;
    static final int ATOMIC_BIT = 1 << 8;
    static final int BATCH_SHIFT = 9;
    static final int BATCH_MASK = 0x7;

    public static final TraderProtection NONE = new TraderProtection(0, 0, 0, false, 0);

    public TraderProtection {
        if ((accessMode & ~MODE_MASK) != 0 || (circuitMode & ~MODE_MASK) != 0 || (volumeMode & ~MODE_MASK) != 0)
            throw new IllegalArgumentException("Protection modes are 2-bit values");
        if ((batchMode & ~BATCH_MASK) != 0)
            throw new IllegalArgumentException("Batch mode is a 3-bit value: " + batchMode);
    }

    public static TraderProtection decode(int word) {
        if (word == 0)
            return NONE;
        return new TraderProtection(
                word & MODE_MASK,
                (word >>> CIRCUIT_SHIFT) & MODE_MASK,
                (word >>> VOLUME_SHIFT) & MODE_MASK,
                (word & ATOMIC_BIT) != 0,
                (word >>> BATCH_SHIFT) & BATCH_MASK);
    }

    public int encode() {
        return accessMode
                | circuitMode << CIRCUIT_SHIFT
                | volumeMode << VOLUME_SHIFT
                | (atomic ? ATOMIC_BIT : 0)
                | batchMode << BATCH_SHIFT;
    }

    public static int atomicWord(int batchMode) {
        return new TraderProtection(0, 0, 0, true, batchMode).encode();
    }

    public boolean isNone() {
        return encode() == 0;
    }
}
