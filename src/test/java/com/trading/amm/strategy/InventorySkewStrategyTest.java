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

public class InventorySkewStrategyTest {
    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final double MID = 2.0;

    private static RoutedPayload mid() {
        byte[] none = new byte[0];
        return new RoutedPayload(List.of(PriceData.of(MID, 1).encode(), none, none, none), none, null);
    }

    private static QuoteParams params(long r0, long r1, int bucket, boolean zeroForOne) {
        return new QuoteParams(Address.fromLong(1), Address.fromLong(2), Address.fromLong(3), E18,
                BigInteger.valueOf(r0).multiply(E18), BigInteger.valueOf(r1).multiply(E18),
                new Marking(0b0001, bucket, 0, false), zeroForOne);
    }

    @Test
    public void testBalancedPoolQuotesAroundMid() {
        InventorySkewStrategy s = new InventorySkewStrategy();
        // 1000 units of asset0 at mid 2 balance 2000 of asset1
        BigInteger sell = s.quote(params(1000, 2000, 4, true), mid());
        BigInteger buy = s.quote(params(1000, 2000, 4, false), mid());

        assertTrue(sell.compareTo(BigInteger.valueOf(2).multiply(E18)) < 0);
        assertTrue(sell.compareTo(BigInteger.valueOf(19).multiply(E18).divide(BigInteger.TEN)) > 0);
        assertTrue(buy.compareTo(E18.divide(BigInteger.TWO)) < 0);
    }

    @Test
    public void testLongPoolQuotesLower() {
        InventorySkewStrategy s = new InventorySkewStrategy();
        BigInteger balanced = s.quote(params(1000, 2000, 8, true), mid());
        BigInteger longAsset0 = s.quote(params(3000, 2000, 8, true), mid());
        assertTrue(longAsset0.compareTo(balanced) < 0);
    }

    @Test
    public void testWiderBucketWiderSpread() {
        InventorySkewStrategy s = new InventorySkewStrategy();
        assertTrue(s.quote(params(1000, 2000, 9, true), mid())
                .compareTo(s.quote(params(1000, 2000, 2, true), mid())) < 0);
    }

    @Test
    public void testModelHelpers() {
        assertEquals(0.001, new InventorySkewStrategy(0, 500).halfSpread(10), 1e-12);
        assertEquals(1e-6, InventorySkewStrategy.sigma2tau(10), 1e-15);
        assertEquals(0.0, InventorySkewStrategy.imbalance(1000, 2000, 2.0), 1e-12);
        assertEquals(0.5, InventorySkewStrategy.imbalance(3000, 2000, 2.0), 1e-12);
        assertEquals(-1.0, InventorySkewStrategy.imbalance(0, 2000, 2.0), 1e-12);
        assertEquals(0.0, InventorySkewStrategy.imbalance(0, 0, 2.0), 0.0);
    }

    @Test
    public void testNoPriceNoQuote() {
        assertEquals(BigInteger.ZERO, new InventorySkewStrategy().quote(params(1000, 2000, 0, true),
                RoutedPayload.EMPTY));
    }
}
