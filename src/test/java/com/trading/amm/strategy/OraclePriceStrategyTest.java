package com.trading.amm.strategy;

import com.trading.amm.api.Address;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.core.Marking;
import com.trading.amm.quote.PriceData;

import org.junit.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.Assert.*;

public class OraclePriceStrategyTest {
    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final BigInteger DEEP = BigInteger.valueOf(1_000_000).multiply(E18);

    private static RoutedPayload price(double p) {
        byte[] none = new byte[0];
        return new RoutedPayload(List.of(none, PriceData.of(p, 1).encode(), none, none), none, null);
    }

    private static QuoteParams params(BigInteger in, int bucket, boolean zeroForOne) {
        return new QuoteParams(Address.fromLong(1), Address.fromLong(2), Address.fromLong(3), in, DEEP, DEEP,
                new Marking(0b0010, bucket, 0, false), zeroForOne);
    }

    @Test
    public void testSellAssetZero() {
        // 130 per unit less 30 bps
        BigInteger out = new OraclePriceStrategy(30).quote(params(E18, 0, true), price(130.0));
        assertEquals(BigInteger.valueOf(130).multiply(E18).multiply(BigInteger.valueOf(9970))
                .divide(BigInteger.valueOf(10_000)), out);
    }

    @Test
    public void testBuyAssetZero() {
        BigInteger out = new OraclePriceStrategy(30).quote(params(BigInteger.valueOf(130).multiply(E18), 0, false),
                price(130.0));
        assertEquals(E18.multiply(BigInteger.valueOf(9970)).divide(BigInteger.valueOf(10_000)), out);
    }

    @Test
    public void testHigherBucketQuotesWider() {
        OraclePriceStrategy s = new OraclePriceStrategy(30);
        BigInteger bucket0 = s.quote(params(E18, 0, true), price(130.0));
        BigInteger bucket20 = s.quote(params(E18, 20, true), price(130.0));
        assertEquals(BigInteger.valueOf(130).multiply(E18).multiply(BigInteger.valueOf(9950))
                .divide(BigInteger.valueOf(10_000)), bucket20);
        assertTrue(bucket20.compareTo(bucket0) < 0);
    }

    @Test
    public void testNoDataOrShallowPool() {
        OraclePriceStrategy s = new OraclePriceStrategy(30);
        assertEquals(BigInteger.ZERO, s.quote(params(E18, 0, true), RoutedPayload.EMPTY));

        QuoteParams shallow = params(E18, 0, true).withReserves(DEEP, BigInteger.valueOf(10).multiply(E18));
        assertEquals(BigInteger.ZERO, s.quote(shallow, price(130.0)));
    }
}
