package com.trading.amm.core;

/**
 * Codec for the 24-bit pool marking word.
 *
 * Wire layout (bit 0 = least significant):
 *
 * <pre>
 *  23      20 19                              4 3   0
 * +----------+---------------------------------+-----+
 * | extra    |            bucket id            | brg |
 * +----------+---------------------------------+-----+
 * </pre>
 *
 * - bits 0..3: default-bridge selectors; bit 0 doubles as the enhanced-context
 * flag.
 * - bits 4..19: bucket id.
 * - bits 20..23: extra-bridge slot (0 none, 1..14 configurable, 15
 * consolidated).
 *
 * Both directions are total: every 24-bit word decodes, and bits above 23 are
 * ignored. External integrators must reproduce this layout exactly to derive a
 * pool id, so no call site may shift marking bits by hand.
 */
public final class MarkingCodec {
    public static final int WORD_MASK = 0xFFFFFF;

    public static final int ENHANCED_CONTEXT_FLAG = 0x1;
    public static final int DEFAULT_BRIDGE_COUNT = 4;
    public static final int BRIDGE_MASK = 0xF;

    public static final int BUCKET_SHIFT = 4;
    public static final int BUCKET_MASK = 0xFFFF;

    public static final int EXTRA_SLOT_SHIFT = 20;
    public static final int EXTRA_SLOT_MASK = 0xF;
    public static final int CONSOLIDATED_SLOT = 15;

    private MarkingCodec() {
        // Utility class
    }

    public static Marking decode(int word) {
        int w = word & WORD_MASK;
        return new Marking(
                w & BRIDGE_MASK,
                (w >>> BUCKET_SHIFT) & BUCKET_MASK,
                (w >>> EXTRA_SLOT_SHIFT) & EXTRA_SLOT_MASK,
                (w & ENHANCED_CONTEXT_FLAG) != 0);
    }

    public static int encode(Marking marking) {
        int w = marking.bridgeMask() & BRIDGE_MASK;
        if (marking.enhancedContext())
            w |= ENHANCED_CONTEXT_FLAG;
        w |= (marking.bucketId() & BUCKET_MASK) << BUCKET_SHIFT;
        w |= (marking.extraSlot() & EXTRA_SLOT_MASK) << EXTRA_SLOT_SHIFT;
        return w;
    }

    public static int compose(int bridgeMask, int bucketId, int extraSlot) {
        return encode(new Marking(bridgeMask, bucketId, extraSlot, false));
    }

    /** Three big-endian bytes, as the word appears inside a packed pool id. */
    public static byte[] toBytes(int word) {
        int w = word & WORD_MASK;
        return new byte[] { (byte) (w >>> 16), (byte) (w >>> 8), (byte) w };
    }

    public static int fromBytes(byte[] bytes, int offset) {
        return ((bytes[offset] & 0xFF) << 16) | ((bytes[offset + 1] & 0xFF) << 8) | (bytes[offset + 2] & 0xFF);
    }

    public static String toHex(int word) {
        return String.format("0x%06x", word & WORD_MASK);
    }

    public static int parseHex(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        int value = Integer.parseUnsignedInt(digits, 16);
        if ((value & ~WORD_MASK) != 0)
            throw new IllegalArgumentException("Marking wider than 24 bits: " + hex);
        return value;
    }
}
