package com.trading.amm.core;

/**
 * Structured form of the 24-bit pool marking word.
 *
 * <ul>
 * <li>{@code bridgeMask}: 4 bits, bit {@code i} selects default data bridge
 * {@code i}.</li>
 * <li>{@code bucketId}: 16 bits, the pricing-parameter variant.</li>
 * <li>{@code extraSlot}: 4 bits, 0 = none, 1..14 = configurable bridge, 15 =
 * consolidated bridge.</li>
 * <li>{@code enhancedContext}: bit 0 of the word. It shares that bit with the
 * selector of default bridge 0, so the two are always equal in a normalised
 * marking.</li>
 * </ul>
 *
 * Use {@link MarkingCodec} to convert from and to the packed word.
 */
public record Marking(int bridgeMask, int bucketId, int extraSlot, boolean enhancedContext) {

    public static final Marking NONE = new Marking(0, 0, 0, false);

    public Marking {
        if (bridgeMask < 0 || bridgeMask > MarkingCodec.BRIDGE_MASK)
            throw new IllegalArgumentException("bridgeMask out of range: " + bridgeMask);
        if (bucketId < 0 || bucketId > MarkingCodec.BUCKET_MASK)
            throw new IllegalArgumentException("bucketId out of range: " + bucketId);
        if (extraSlot < 0 || extraSlot > MarkingCodec.EXTRA_SLOT_MASK)
            throw new IllegalArgumentException("extraSlot out of range: " + extraSlot);

        // bit 0 is shared
        if (enhancedContext)
            bridgeMask |= MarkingCodec.ENHANCED_CONTEXT_FLAG;
        enhancedContext = (bridgeMask & MarkingCodec.ENHANCED_CONTEXT_FLAG) != 0;
    }

    public boolean usesDefaultBridge(int index) {
        if (index < 0 || index >= MarkingCodec.DEFAULT_BRIDGE_COUNT)
            return false;
        return (bridgeMask & (1 << index)) != 0;
    }

    /** True when a configurable extra bridge (slot 1..14) is selected. */
    public boolean usesExtraBridge() {
        return extraSlot > 0 && extraSlot < MarkingCodec.CONSOLIDATED_SLOT;
    }

    public boolean usesConsolidatedBridge() {
        return extraSlot == MarkingCodec.CONSOLIDATED_SLOT;
    }

    public int encode() {
        return MarkingCodec.encode(this);
    }
}
