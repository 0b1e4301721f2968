package com.trading.amm.api;

import java.math.BigInteger;

/**
 * Fungible transfer collaborator used at settlement.
 *
 * The engine never keeps user balances itself. It only asks this collaborator to
 * move net amounts between a user and the engine's custody account. A transfer
 * that cannot be honoured must throw; the engine then rolls the whole call back.
 */
public interface TokenTransfers {

    /**
     * Moves {@code amount} of {@code token} from {@code from} into custody.
     *
     * @throws com.trading.amm.error.SessionException with
     *         {@code INSUFFICIENT_FUNDS} when the payer cannot cover it
     */
    void pull(Address from, Address token, BigInteger amount);

    /** Moves {@code amount} of {@code token} out of custody to {@code to}. */
    void push(Address to, Address token, BigInteger amount);
}
