package com.trading.amm.quote;

import com.trading.amm.api.Address;
import com.trading.amm.api.DataBridge;
import com.trading.amm.core.MarkingCodec;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

import java.util.Objects;

/**
 * Slot table of data bridges.
 *
 * Four default slots (selected by the marking's bridge bits), fourteen
 * configurable extra slots (marking slot 1..14) and one consolidated bridge
 * (marking slot 15). An empty slot simply yields no data.
 */
public final class BridgeRegistry {
    private static final int EXTRA_SLOTS = MarkingCodec.CONSOLIDATED_SLOT - 1;

    private final Entry[] defaults = new Entry[MarkingCodec.DEFAULT_BRIDGE_COUNT];
    private final Entry[] extras = new Entry[EXTRA_SLOTS + 1];
    private Entry consolidated;

    public void setDefaultBridge(int index, Address handle, DataBridge bridge) {
        if (index < 0 || index >= defaults.length)
            throw new ConfigurationException(ErrorCode.INVALID_BRIDGE_SLOT, "Default bridge index " + index);
        defaults[index] = entry(handle, bridge);
    }

    public void setExtraBridge(int slot, Address handle, DataBridge bridge) {
        if (slot < 1 || slot > EXTRA_SLOTS)
            throw new ConfigurationException(ErrorCode.INVALID_BRIDGE_SLOT, "Extra bridge slot " + slot);
        extras[slot] = entry(handle, bridge);
    }

    public void setConsolidatedBridge(Address handle, DataBridge bridge) {
        consolidated = entry(handle, bridge);
    }

    /** Bridge in default slot {@code index}, or {@code null}. */
    public Entry defaultBridge(int index) {
        return index >= 0 && index < defaults.length ? defaults[index] : null;
    }

    /** Bridge for a marking extra-slot value; {@code null} for 0 or an empty slot. */
    public Entry extraBridge(int slot) {
        if (slot == MarkingCodec.CONSOLIDATED_SLOT)
            return consolidated;
        return slot >= 1 && slot <= EXTRA_SLOTS ? extras[slot] : null;
    }

    private static Entry entry(Address handle, DataBridge bridge) {
        if (bridge == null)
            return null;
        return new Entry(Objects.requireNonNull(handle, "handle"), bridge);
    }

    /** A bridge and the handle its responses are cached under. */
    public record Entry(Address handle, DataBridge bridge) {
    }
}
