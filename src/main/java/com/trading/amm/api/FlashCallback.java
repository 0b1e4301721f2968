package com.trading.amm.api;

import com.trading.amm.engine.PoolManager;

/**
 * Entry point invoked while a flash session is open.
 *
 * The callback may re-enter any swap or liquidity operation of the manager it is
 * handed. Every delta it produces for the session owner is deferred and netted,
 * then settled once when the callback returns.
 */
@FunctionalInterface
public interface FlashCallback {

    /**
     * @param manager the engine, for re-entrant calls
     * @param owner   the session owner and beneficiary of nested operations
     * @param data    opaque caller data passed through unchanged
     */
    void onFlashSession(PoolManager manager, Address owner, byte[] data);
}
