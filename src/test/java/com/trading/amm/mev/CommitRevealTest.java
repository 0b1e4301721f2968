package com.trading.amm.mev;

import com.trading.amm.api.Address;
import com.trading.amm.core.StateJournal;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.Assert.*;

public class CommitRevealTest {
    private static final Address TRADER = Address.fromLong(0xA11CEL);
    private static final long WINDOW = 256;
    private static final long B = 100;

    private final SwapIntent intent = new SwapIntent(Address.fromLong(0x20), Address.fromLong(0x10),
            Address.fromLong(0xC0FFEEL), 0, BigInteger.valueOf(1_000), true, BigInteger.valueOf(900));
    private final byte[] salt = new byte[32];

    private CommitReveal cr;

    @Before
    public void setUp() {
        Arrays.fill(salt, (byte) 7);
        cr = new CommitReveal(new StateJournal(), WINDOW);
        cr.commit(TRADER, CommitReveal.commitmentHash(intent, 0, TRADER, salt), B);
    }

    private void expect(ErrorCode code, long block, long nonce, byte[] s) {
        try {
            cr.reveal(TRADER, intent, nonce, s, block);
            fail("Expected " + code);
        } catch (MevProtectionException e) {
            assertEquals(code, e.code());
        }
    }

    @Test
    public void testRevealWindowBoundaries() {
        // 1. Same block is too new
        expect(ErrorCode.COMMITMENT_TOO_NEW, B, 0, salt);

        // 2. Past the deadline
        expect(ErrorCode.COMMITMENT_EXPIRED, B + WINDOW + 1, 0, salt);
        assertEquals(B + WINDOW, cr.revealDeadline(TRADER));

        // 3. The next block works
        cr.reveal(TRADER, intent, 0, salt, B + 1);
        assertEquals(1, cr.nonce(TRADER));
        assertFalse(cr.hasPendingCommitment(TRADER));
        assertEquals(-1, cr.revealDeadline(TRADER));
    }

    @Test
    public void testLastBlockOfWindowAccepted() {
        cr.reveal(TRADER, intent, 0, salt, B + WINDOW);
        assertEquals(1, cr.nonce(TRADER));
    }

    @Test
    public void testReplayRejected() {
        cr.reveal(TRADER, intent, 0, salt, B + 1);
        expect(ErrorCode.INVALID_COMMITMENT, B + 2, 0, salt);
        expect(ErrorCode.INVALID_COMMITMENT, B + 2, 1, salt);
    }

    @Test
    public void testWrongNonceOrSalt() {
        expect(ErrorCode.INVALID_NONCE, B + 1, 5, salt);

        byte[] otherSalt = salt.clone();
        otherSalt[0] = 8;
        expect(ErrorCode.INVALID_COMMITMENT, B + 1, 0, otherSalt);

        // Failed reveals leave the commitment in place
        assertTrue(cr.hasPendingCommitment(TRADER));
        assertEquals(0, cr.nonce(TRADER));
    }

    @Test
    public void testTamperedIntentRejected() {
        SwapIntent bigger = new SwapIntent(intent.assetA(), intent.assetB(), intent.strategy(), 0,
                BigInteger.valueOf(1_001), true, intent.minOut());
        try {
            cr.reveal(TRADER, bigger, 0, salt, B + 1);
            fail("Amount differs from the commitment");
        } catch (MevProtectionException e) {
            assertEquals(ErrorCode.INVALID_COMMITMENT, e.code());
        }
    }

    @Test
    public void testHashIsCanonicalAndBoundToTrader() {
        SwapIntent flipped = new SwapIntent(intent.assetB(), intent.assetA(), intent.strategy(), 0,
                intent.amountIn(), true, intent.minOut());
        assertArrayEquals(CommitReveal.commitmentHash(intent, 0, TRADER, salt),
                CommitReveal.commitmentHash(flipped, 0, TRADER, salt));
        assertFalse(Arrays.equals(CommitReveal.commitmentHash(intent, 0, TRADER, salt),
                CommitReveal.commitmentHash(intent, 0, Address.fromLong(0xB0B), salt)));
        assertFalse(Arrays.equals(CommitReveal.commitmentHash(intent, 0, TRADER, salt),
                CommitReveal.commitmentHash(intent, 1, TRADER, salt)));
    }

    @Test
    public void testNewCommitReplacesPending() {
        SwapIntent second = new SwapIntent(intent.assetA(), intent.assetB(), intent.strategy(), 0,
                BigInteger.valueOf(5), true, BigInteger.ZERO);
        cr.commit(TRADER, CommitReveal.commitmentHash(second, 0, TRADER, salt), B + 10);

        expect(ErrorCode.INVALID_COMMITMENT, B + 11, 0, salt); // first intent no longer matches
        cr.reveal(TRADER, second, 0, salt, B + 11);
    }

    @Test
    public void testMalformedInputs() {
        try {
            cr.commit(TRADER, new byte[31], B);
            fail("Hash must be 32 bytes");
        } catch (MevProtectionException e) {
            assertEquals(ErrorCode.INVALID_COMMITMENT, e.code());
        }
        try {
            CommitReveal.commitmentHash(intent, 0, TRADER, new byte[16]);
            fail("Salt must be 32 bytes");
        } catch (MevProtectionException e) {
            assertEquals(ErrorCode.INVALID_COMMITMENT, e.code());
        }
    }
}
