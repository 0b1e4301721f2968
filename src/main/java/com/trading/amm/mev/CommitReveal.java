package com.trading.amm.mev;

import com.trading.amm.api.Address;
import com.trading.amm.core.PoolIdentity;
import com.trading.amm.core.PoolKey;
import com.trading.amm.core.StateJournal;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Commit-reveal state machine, one live commitment per trader.
 *
 * <pre>
 * NoCommitment --commit(hash)@B--> Committed(B, nonce)
 * Committed --reveal in (B, B + window]--> Consumed (record cleared, nonce + 1)
 * </pre>
 *
 * Reveal checks run in a fixed order, each with its own code: no record
 * ({@code INVALID_COMMITMENT}), block not past B ({@code COMMITMENT_TOO_NEW}),
 * block past B + window ({@code COMMITMENT_EXPIRED}), stale nonce
 * ({@code INVALID_NONCE}), hash mismatch ({@code INVALID_COMMITMENT}). A newer
 * commit replaces a pending one.
 */
@Log4j2
public final class CommitReveal {
    public static final int SALT_LENGTH = 32;

    private final StateJournal journal;
    private final long window;
    private final Map<Address, CommitRecord> commitments = new HashMap<>();
    private final Map<Address, Long> nonces = new HashMap<>();

    public CommitReveal(StateJournal journal, long window) {
        if (window <= 0)
            throw new IllegalArgumentException("Reveal window must be positive: " + window);
        this.journal = journal;
        this.window = window;
    }

    public long window() {
        return window;
    }

    public void commit(Address trader, byte[] commitmentHash, long blockNumber) {
        Objects.requireNonNull(trader, "trader");
        if (commitmentHash == null || commitmentHash.length != 32)
            throw new MevProtectionException(ErrorCode.INVALID_COMMITMENT, "Commitment hash must be 32 bytes");
        journal.put(commitments, trader, new CommitRecord(commitmentHash.clone(), blockNumber, nonce(trader)));
        log.debug("Commitment from {} at block {}", trader, blockNumber);
    }

    /**
     * Validates and consumes {@code trader}'s commitment. On success the
     * ordinary swap may run.
     */
    public void reveal(Address trader, SwapIntent intent, long nonce, byte[] salt, long blockNumber) {
        CommitRecord rec = commitments.get(trader);
        if (rec == null)
            throw new MevProtectionException(ErrorCode.INVALID_COMMITMENT, "No pending commitment for " + trader);
        if (blockNumber <= rec.block())
            throw new MevProtectionException(ErrorCode.COMMITMENT_TOO_NEW,
                    "Reveal at block " + blockNumber + " not after commit block " + rec.block());
        if (blockNumber > rec.block() + window)
            throw new MevProtectionException(ErrorCode.COMMITMENT_EXPIRED,
                    "Reveal at block " + blockNumber + " past deadline " + (rec.block() + window));
        if (nonce != nonce(trader) || nonce != rec.nonce())
            throw new MevProtectionException(ErrorCode.INVALID_NONCE,
                    "Nonce " + nonce + " does not match live nonce " + nonce(trader));
        if (!MessageDigest.isEqual(rec.hash(), commitmentHash(intent, nonce, trader, salt)))
            throw new MevProtectionException(ErrorCode.INVALID_COMMITMENT, "Revealed swap does not match commitment");

        journal.remove(commitments, trader);
        journal.put(nonces, trader, nonce + 1);
    }

    public long nonce(Address trader) {
        return nonces.getOrDefault(trader, 0L);
    }

    public boolean hasPendingCommitment(Address trader) {
        return commitments.containsKey(trader);
    }

    /** Deadline block of the pending commitment, or -1. */
    public long revealDeadline(Address trader) {
        CommitRecord rec = commitments.get(trader);
        return rec == null ? -1 : rec.block() + window;
    }

    /**
     * SHA3-256 over the canonical swap fields, nonce, trader and salt.
     *
     * Layout: {@code asset0[20] asset1[20] strategy[20] marking[3] amountIn[32]
     * zeroForOne[1] minOut[32] nonce[8] trader[20] salt[32]}.
     */
    public static byte[] commitmentHash(SwapIntent intent, long nonce, Address trader, byte[] salt) {
        if (salt == null || salt.length != SALT_LENGTH)
            throw new MevProtectionException(ErrorCode.INVALID_COMMITMENT, "Salt must be " + SALT_LENGTH + " bytes");
        PoolKey key = PoolIdentity.canonicalKey(intent.assetA(), intent.assetB(), intent.strategy(), intent.marking());
        ByteBuffer buf = ByteBuffer.allocate(20 * 4 + 3 + 32 * 3 + 1 + 8);
        buf.put(key.asset0().toBytes())
                .put(key.asset1().toBytes())
                .put(key.strategy().toBytes())
                .put((byte) (key.marking() >>> 16)).put((byte) (key.marking() >>> 8)).put((byte) key.marking())
                .put(word(intent.amountIn()))
                .put((byte) (intent.zeroForOne() ? 1 : 0))
                .put(word(intent.minOut()))
                .putLong(nonce)
                .put(trader.toBytes())
                .put(salt);
        try {
            return MessageDigest.getInstance("SHA3-256").digest(buf.array());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA3-256 not available", e);
        }
    }

    private static byte[] word(BigInteger v) {
        if (v.signum() < 0 || v.bitLength() > 256)
            throw new IllegalArgumentException("Value does not fit 256 bits: " + v);
        byte[] raw = v.toByteArray();
        byte[] out = new byte[32];
        int len = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - len, out, 32 - len, len);
        return out;
    }

    private record CommitRecord(byte[] hash, long block, long nonce) {
    }
}
