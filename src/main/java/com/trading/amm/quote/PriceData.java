package com.trading.amm.quote;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Reference bridge payload: two big-endian 256-bit words, the price scaled by
 * 1e18 followed by the observation timestamp in seconds.
 */
public record PriceData(BigInteger priceWad, long timestamp) {
    public static final int WORD = 32;
    public static final int LENGTH = WORD * 2;
    private static final BigDecimal WAD = new BigDecimal(BigInteger.TEN.pow(18));

    public PriceData {
        Objects.requireNonNull(priceWad, "priceWad");
        if (priceWad.signum() < 0 || priceWad.bitLength() > 256)
            throw new IllegalArgumentException("Price out of range: " + priceWad);
        if (timestamp < 0)
            throw new IllegalArgumentException("Negative timestamp");
    }

    public static PriceData of(double price, long timestamp) {
        return new PriceData(BigDecimal.valueOf(price).multiply(WAD).toBigInteger(), timestamp);
    }

    public double price() {
        return new BigDecimal(priceWad).divide(WAD).doubleValue();
    }

    public byte[] encode() {
        byte[] out = new byte[LENGTH];
        writeWord(priceWad, out, 0);
        writeWord(BigInteger.valueOf(timestamp), out, WORD);
        return out;
    }

    public static boolean isEncoded(byte[] data) {
        return data != null && data.length >= LENGTH;
    }

    public static PriceData decode(byte[] data) {
        if (!isEncoded(data))
            throw new IllegalArgumentException("Price payload must be at least " + LENGTH + " bytes");
        BigInteger price = readWord(data, 0);
        BigInteger ts = readWord(data, WORD);
        return new PriceData(price, ts.longValueExact());
    }

    private static void writeWord(BigInteger v, byte[] out, int offset) {
        byte[] raw = v.toByteArray();
        int len = Math.min(raw.length, WORD);
        // toByteArray may carry a leading sign byte
        System.arraycopy(raw, raw.length - len, out, offset + WORD - len, len);
    }

    private static BigInteger readWord(byte[] data, int offset) {
        byte[] word = new byte[WORD];
        System.arraycopy(data, offset, word, 0, WORD);
        return new BigInteger(1, word);
    }
}
