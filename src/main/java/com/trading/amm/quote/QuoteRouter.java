package com.trading.amm.quote;

import com.trading.amm.api.Address;
import com.trading.amm.api.BlockContext;
import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.api.TraderContext;
import com.trading.amm.core.Marking;
import com.trading.amm.core.MarkingCodec;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolIdentity;
import com.trading.amm.error.AmmException;
import com.trading.amm.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Gathers bridge payloads for a quote and dispatches to the pool's pricing
 * strategy.
 *
 * <h3>Routing</h3>
 * <ol>
 * <li>Decode the marking carried by the params.</li>
 * <li>For each selected default bridge (up to four) fetch its payload.</li>
 * <li>Fetch the extra or consolidated bridge named by the extra slot.</li>
 * <li>Append a {@link TraderContext} when the enhanced-context flag is set.</li>
 * <li>Call {@link PricingStrategy#quote}.</li>
 * </ol>
 *
 * <h3>Failure Handling</h3>
 * Bridges and strategies are untrusted. A bridge exception, a {@code null} or
 * an empty response all become an empty payload. A strategy exception, a
 * {@code null} or a negative result all become zero, the "no price" signal.
 * Failures are logged through a per-handle {@link ErrorRateLimiter}.
 * {@link AmmException}s raised by the engine itself (a blocked reentrant call)
 * are never swallowed.
 */
public final class QuoteRouter {
    private static final Logger log = LogManager.getLogger(QuoteRouter.class);
    private static final byte[] NO_DATA = new byte[0];

    private final StrategyRegistry strategies;
    private final BridgeRegistry bridges;
    private final BlockContext block;
    private final ErrorRateLimiter errLimiter;

    public QuoteRouter(StrategyRegistry strategies, BridgeRegistry bridges, BlockContext block,
            long bridgeErrorLogIntervalMillis) {
        this.strategies = strategies;
        this.bridges = bridges;
        this.block = block;
        this.errLimiter = new ErrorRateLimiter(log, bridgeErrorLogIntervalMillis);
    }

    /** Quotes against explicit reserves, overriding those carried by {@code params}. */
    public Quote getQuote(QuoteParams params, BigInteger reserve0, BigInteger reserve1, BridgeCache cache,
            boolean sessionActive) {
        return getQuote(params.withReserves(reserve0, reserve1), cache, sessionActive);
    }

    public Quote getQuote(QuoteParams params, BridgeCache cache, boolean sessionActive) {
        PoolId poolId = PoolIdentity.assemble(params.asset0(), params.asset1(), params.strategy(),
                params.marking().encode());
        PricingStrategy strategy = strategies.get(params.strategy());
        RoutedPayload payload = route(params, cache, sessionActive);
        BigInteger out = safeQuote(params.strategy(), () -> strategy.quote(params, payload));
        if (log.isDebugEnabled())
            log.debug("Quoted {} in -> {} out on {}", params.amountIn(), out, poolId);
        return new Quote(out, poolId);
    }

    /**
     * Prices several markings of one pair and strategy in one strategy call.
     * Bridge responses are shared through {@code cache}.
     */
    public BigInteger[] getQuoteBatch(List<QuoteParams> params, BridgeCache cache, boolean sessionActive) {
        if (params.isEmpty())
            return new BigInteger[0];
        QuoteParams first = params.get(0);
        List<RoutedPayload> payloads = new ArrayList<>(params.size());
        for (QuoteParams p : params) {
            if (!p.asset0().equals(first.asset0()) || !p.asset1().equals(first.asset1())
                    || !p.strategy().equals(first.strategy()))
                throw new IllegalArgumentException("Batch quotes must share one pair and strategy");
            payloads.add(route(p, cache, sessionActive));
        }
        PricingStrategy strategy = strategies.get(first.strategy());
        BigInteger[] raw;
        try {
            raw = strategy.quoteBatch(params, payloads);
        } catch (AmmException e) {
            throw e;
        } catch (RuntimeException e) {
            errLimiter.log(first.strategy().hex(), "Strategy " + first.strategy() + " failed a batch: " + e, e);
            raw = null;
        }
        BigInteger[] out = new BigInteger[params.size()];
        if (raw == null || raw.length != params.size()) {
            if (raw != null)
                log.warn("Strategy {} returned {} quotes for {} params", first.strategy(), raw.length, params.size());
            Arrays.fill(out, BigInteger.ZERO);
            return out;
        }
        for (int i = 0; i < raw.length; i++)
            out[i] = sanitize(raw[i]);
        return out;
    }

    /** Assembles the routed payload for {@code params}. Visible for inspection and tests. */
    public RoutedPayload route(QuoteParams params, BridgeCache cache, boolean sessionActive) {
        Marking m = params.marking();
        List<byte[]> defaults = new ArrayList<>(MarkingCodec.DEFAULT_BRIDGE_COUNT);
        for (int i = 0; i < MarkingCodec.DEFAULT_BRIDGE_COUNT; i++) {
            defaults.add(m.usesDefaultBridge(i) ? fetch(bridges.defaultBridge(i), params, cache) : NO_DATA);
        }
        byte[] extra = NO_DATA;
        if (m.extraSlot() != 0)
            extra = fetch(bridges.extraBridge(m.extraSlot()), params, cache);

        TraderContext context = null;
        if (m.enhancedContext())
            context = new TraderContext(block.timestamp(), block.blockNumber(), block.gasPrice(), sessionActive);
        return new RoutedPayload(defaults, extra, context);
    }

    private byte[] fetch(BridgeRegistry.Entry entry, QuoteParams params, BridgeCache cache) {
        if (entry == null)
            return NO_DATA;
        return cache.getOrFetch(entry.handle(), params.asset0(), params.asset1(), () -> safeFetch(entry, params));
    }

    private byte[] safeFetch(BridgeRegistry.Entry entry, QuoteParams params) {
        try {
            byte[] data = entry.bridge().getData(params);
            return data == null ? NO_DATA : data;
        } catch (RuntimeException e) {
            errLimiter.log(entry.handle().hex(),
                    String.format("Bridge %s failed for %s/%s: %s", entry.handle(), params.asset0(),
                            params.asset1(), e.getMessage()),
                    e);
            return NO_DATA;
        }
    }

    private BigInteger safeQuote(Address handle, Supplier<BigInteger> quote) {
        try {
            return sanitize(quote.get());
        } catch (AmmException e) {
            throw e;
        } catch (RuntimeException e) {
            errLimiter.log(handle.hex(), "Strategy " + handle + " failed: " + e, e);
            return BigInteger.ZERO;
        }
    }

    private static BigInteger sanitize(BigInteger v) {
        return v == null || v.signum() < 0 ? BigInteger.ZERO : v;
    }
}
