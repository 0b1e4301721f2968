package com.trading.amm.engine;

import com.trading.amm.api.Address;
import com.trading.amm.api.BlockContext;
import com.trading.amm.api.EngineListener;
import com.trading.amm.api.FlashCallback;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.TokenTransfers;
import com.trading.amm.core.InventoryLedger;
import com.trading.amm.core.LiquidityShareLedger;
import com.trading.amm.core.MarkingCodec;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolIdentity;
import com.trading.amm.core.PoolKey;
import com.trading.amm.core.PoolState;
import com.trading.amm.core.ReentrancyGuard;
import com.trading.amm.core.StateJournal;
import com.trading.amm.core.UintMath;
import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.LiquidityException;
import com.trading.amm.error.QuoteUnavailableException;
import com.trading.amm.error.SlippageException;
import com.trading.amm.io.EngineConfig;
import com.trading.amm.mev.AccessControl;
import com.trading.amm.mev.AtomicExecution;
import com.trading.amm.mev.CircuitBreaker;
import com.trading.amm.mev.CommitReveal;
import com.trading.amm.mev.PoolFeature;
import com.trading.amm.mev.ProtectionPolicy;
import com.trading.amm.mev.SwapIntent;
import com.trading.amm.mev.TraderProtection;
import com.trading.amm.mev.VolumeControl;
import com.trading.amm.quote.BridgeCache;
import com.trading.amm.quote.BridgeRegistry;
import com.trading.amm.quote.Quote;
import com.trading.amm.quote.QuoteRouter;
import com.trading.amm.quote.StrategyRegistry;
import com.trading.amm.session.FlashAccountingSession;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Orchestrator of the AMM: pool registry, liquidity, swaps, batch swaps, flash
 * sessions and commit-reveal, composed over the ledgers, the quote router and
 * the protection modules.
 *
 * <h3>Atomicity</h3>
 * Every public mutating entry point runs inside a {@link StateJournal}
 * transaction. Any failure reverts all ledger, session, commitment, counter and
 * (journal-aware) vault writes made during the call before the exception
 * propagates; there is no partial success. Calls re-entered from a flash
 * callback nest inside the outer transaction.
 *
 * <h3>Settlement</h3>
 * Operations never move tokens directly. They record signed deltas for the
 * beneficiary in the {@link FlashAccountingSession}; when the beneficiary has
 * no open session the deltas are settled at the end of the same call,
 * otherwise they are netted and settled once when the session closes. The
 * beneficiary is the active session user when one is set, else the caller.
 *
 * <h3>Reentrancy</h3>
 * A per-pool {@link ReentrancyGuard} scope is held while a pool is priced and
 * mutated, so a strategy or bridge calling back into the same pool fails with
 * {@code REENTRANT_CALL}. Different pools never block each other.
 *
 * <h3>Thread Safety</h3>
 * Not thread-safe. Use {@link com.trading.amm.disruptor.EngineSequencer} to
 * submit work from several threads.
 */
public final class PoolManager {
    private static final Logger log = LogManager.getLogger(PoolManager.class);

    private final StateJournal journal;
    private final InventoryLedger inventory;
    private final LiquidityShareLedger shares;
    private final FlashAccountingSession session;
    private final QuoteRouter router;
    private final StrategyRegistry strategies;
    private final BridgeRegistry bridges;
    private final CommitReveal commitReveal;
    private final AtomicExecution atomicExecution;
    private final AccessControl accessControl;
    private final CircuitBreaker circuitBreaker;
    private final VolumeControl volumeControl;
    private final ReentrancyGuard guard = new ReentrancyGuard();
    private final TokenTransfers transfers;
    private final BlockContext block;
    private final EngineListener listener;
    private final BigInteger permanentLock;

    private final Map<PoolId, PoolKey> pools = new LinkedHashMap<>();
    private final Map<BigInteger, PoolId> poolsByDigest = new HashMap<>();
    private final Map<PoolId, Set<PoolFeature>> poolFeatures = new HashMap<>();
    private final List<Runnable> pendingEvents = new ArrayList<>();
    private ProtocolFeeConfig protocolFee;

    public PoolManager(EngineConfig config, StateJournal journal, StrategyRegistry strategies,
            BridgeRegistry bridges, TokenTransfers transfers, BlockContext block, ProtectionPolicy policy,
            EngineListener listener) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.strategies = Objects.requireNonNull(strategies, "strategies");
        this.bridges = Objects.requireNonNull(bridges, "bridges");
        this.transfers = Objects.requireNonNull(transfers, "transfers");
        this.block = Objects.requireNonNull(block, "block");
        this.listener = listener == null ? EngineListener.NO_OP : listener;
        ProtectionPolicy p = policy == null ? ProtectionPolicy.ALLOW_ALL : policy;

        this.inventory = new InventoryLedger(journal);
        this.shares = new LiquidityShareLedger(journal);
        this.session = new FlashAccountingSession(journal);
        this.router = new QuoteRouter(strategies, bridges, block, config.getBridgeErrorLogIntervalMillis());
        this.commitReveal = new CommitReveal(journal, config.getCommitRevealWindow());
        this.atomicExecution = new AtomicExecution(config.toBatchWindows());
        this.atomicExecution.setEmergencyMode(config.getEmergencyBatchMode());
        this.accessControl = new AccessControl(p);
        this.circuitBreaker = new CircuitBreaker(p);
        this.volumeControl = new VolumeControl(p, journal);
        this.permanentLock = BigInteger.valueOf(config.getPermanentLock());
        this.protocolFee = config.toProtocolFee();
    }

    // ── Pool registry ──────────────────────────────────────────────

    public PoolId createPool(Address caller, Address assetA, Address assetB, Address strategy, int marking) {
        return call(() -> {
            PoolKey key = PoolIdentity.canonicalKey(assetA, assetB, strategy, marking);
            if (!strategies.contains(strategy))
                throw new ConfigurationException(ErrorCode.UNKNOWN_STRATEGY, "No strategy registered for " + strategy);
            PoolId id = PoolIdentity.assemble(key);
            if (pools.containsKey(id))
                throw new ConfigurationException(ErrorCode.POOL_ALREADY_EXISTS, "Pool already exists: " + key);
            journal.put(pools, id, key);
            journal.put(poolsByDigest, id.digest(), id);
            emit(() -> listener.onPoolCreated(id, key));
            log.info("Pool created by {}: {} digest=0x{}", caller, key, id.digest().toString(16));
            return id;
        });
    }

    /** Coordinates of the pool with the given digest, or {@link PoolInfo#EMPTY}. */
    public PoolInfo getPoolInfo(BigInteger digest) {
        PoolId id = poolsByDigest.get(digest);
        return id == null ? PoolInfo.EMPTY : PoolInfo.of(pools.get(id));
    }

    public boolean poolExists(PoolId id) {
        return pools.containsKey(id);
    }

    /** Registered pools in creation order. */
    public List<PoolId> poolIds() {
        return List.copyOf(pools.keySet());
    }

    public PoolKey poolKey(PoolId id) {
        return requirePool(id);
    }

    public PoolState getPoolState(PoolId id) {
        return inventory.getPoolState(id);
    }

    public InventoryLedger.Reserves getInventory(PoolId id) {
        return inventory.getInventory(id);
    }

    public BigInteger sharesOf(PoolId id, Address owner) {
        return shares.balanceOf(id, owner);
    }

    // ── Liquidity ─────────────────────────────────────────────────

    /**
     * Deposits both assets and mints liquidity shares to the beneficiary.
     *
     * First deposit: mints {@code sqrt(a0 * a1) - permanentLock}; the lock is
     * counted in the total supply but owned by nobody. Later deposits mint
     * {@code min(a0 * T / r0, a1 * T / r1)} and keep the full amounts in the
     * pool.
     */
    public LiquidityResult addLiquidity(Address caller, Address assetA, Address assetB, Address strategy,
            int marking, BigInteger amountA, BigInteger amountB) {
        return call(() -> {
            PoolKey key = PoolIdentity.canonicalKey(assetA, assetB, strategy, marking);
            PoolId id = requireCreated(key);
            requirePositive(amountA, "amountA");
            requirePositive(amountB, "amountB");
            boolean aIsZero = key.asset0().equals(assetA);
            BigInteger a0 = aIsZero ? amountA : amountB;
            BigInteger a1 = aIsZero ? amountB : amountA;
            Address user = beneficiary(caller);

            try (ReentrancyGuard.Scope ignored = guard.enter(id)) {
                PoolState state = inventory.getPoolState(id);
                BigInteger minted;
                BigInteger total;
                if (state.isEmpty()) {
                    BigInteger raw = UintMath.sqrt(a0.multiply(a1));
                    if (raw.compareTo(permanentLock) <= 0)
                        throw new ConfigurationException(ErrorCode.INSUFFICIENT_INITIAL_LIQUIDITY,
                                "sqrt(" + a0 + " * " + a1 + ") = " + raw + " does not exceed lock " + permanentLock);
                    minted = raw.subtract(permanentLock);
                    total = raw;
                } else {
                    state = chargeProtocolFee(id, key, state);
                    BigInteger t = state.totalShares();
                    minted = UintMath.min(
                            UintMath.mulDiv(a0, t, state.reserve0()),
                            UintMath.mulDiv(a1, t, state.reserve1()));
                    if (minted.signum() == 0)
                        throw new LiquidityException(ErrorCode.INSUFFICIENT_SHARES, "Deposit too small to mint shares");
                    total = t.add(minted);
                }

                InventoryLedger.Reserves after = inventory.applyDelta(id, a0, a1);
                inventory.setTotalShares(id, total);
                inventory.setProtocolFeeBaseline(id, after);
                shares.credit(id, user, minted);

                session.addDelta(user, key.asset0(), a0.negate());
                session.addDelta(user, key.asset1(), a1.negate());
                emit(() -> listener.onLiquidityAdded(id, user, a0, a1, minted));
                log.debug("Liquidity +({}, {}) -> {} shares for {} on {}", a0, a1, minted, user, key);
                settleIfNoSession(user, List.of(key.asset0(), key.asset1()));
                return new LiquidityResult(id, a0, a1, minted);
            }
        });
    }

    /** Burns {@code shareAmount} and returns {@code shareAmount * reserve / totalShares} of each asset. */
    public LiquidityResult removeLiquidity(Address caller, Address assetA, Address assetB, Address strategy,
            int marking, BigInteger shareAmount) {
        return call(() -> {
            PoolKey key = PoolIdentity.canonicalKey(assetA, assetB, strategy, marking);
            PoolId id = requireCreated(key);
            Address user = beneficiary(caller);

            try (ReentrancyGuard.Scope ignored = guard.enter(id)) {
                PoolState state = inventory.getPoolState(id);
                if (state.isEmpty())
                    throw new LiquidityException(ErrorCode.NO_LIQUIDITY, "Pool has no liquidity: " + key);
                requirePositive(shareAmount, "shares");
                BigInteger held = shares.balanceOf(id, user);
                if (held.compareTo(shareAmount) < 0)
                    throw new LiquidityException(ErrorCode.INSUFFICIENT_SHARES,
                            user + " holds " + held + " shares, requested " + shareAmount);

                state = chargeProtocolFee(id, key, state);
                BigInteger t = state.totalShares();
                BigInteger a0 = UintMath.mulDiv(shareAmount, state.reserve0(), t);
                BigInteger a1 = UintMath.mulDiv(shareAmount, state.reserve1(), t);
                if (a0.signum() == 0 && a1.signum() == 0)
                    throw new LiquidityException(ErrorCode.INSUFFICIENT_WITHDRAWAL,
                            "Withdrawal of " + shareAmount + " shares rounds to zero");

                shares.debit(id, user, shareAmount);
                InventoryLedger.Reserves after = inventory.applyDelta(id, a0.negate(), a1.negate());
                inventory.setTotalShares(id, t.subtract(shareAmount));
                inventory.setProtocolFeeBaseline(id, after);

                session.addDelta(user, key.asset0(), a0);
                session.addDelta(user, key.asset1(), a1);
                emit(() -> listener.onLiquidityRemoved(id, user, a0, a1, shareAmount));
                log.debug("Liquidity -({}, {}) for {} shares of {} on {}", a0, a1, shareAmount, user, key);
                settleIfNoSession(user, List.of(key.asset0(), key.asset1()));
                return new LiquidityResult(id, a0, a1, shareAmount);
            }
        });
    }

    // ── Swaps ─────────────────────────────────────────────────────

    /** Unprotected swap: {@link #swapWithProtection} with a zero trader word. */
    public BigInteger swap(Address caller, Address assetIn, Address assetOut, Address strategy, int marking,
            BigInteger amountIn, boolean zeroForOne, BigInteger minOut) {
        return swapWithProtection(caller, assetIn, assetOut, strategy, marking, amountIn, zeroForOne, minOut, 0);
    }

    /**
     * Swaps {@code amountIn} of {@code assetIn} for {@code assetOut}.
     *
     * @param zeroForOne        direction relative to canonical order; must agree
     *                          with {@code assetIn}
     * @param traderProtection  32-bit trader protection word, see
     *                          {@link TraderProtection}
     * @return the output amount credited to the beneficiary
     */
    public BigInteger swapWithProtection(Address caller, Address assetIn, Address assetOut, Address strategy,
            int marking, BigInteger amountIn, boolean zeroForOne, BigInteger minOut, int traderProtection) {
        return call(() -> {
            PoolKey key = PoolIdentity.canonicalKey(assetIn, assetOut, strategy, marking);
            if (!key.tokenIn(zeroForOne).equals(assetIn))
                throw new ConfigurationException(ErrorCode.INVALID_ASSETS,
                        "Direction zeroForOne=" + zeroForOne + " does not send " + assetIn);
            return swapInternal(caller, key, amountIn, zeroForOne, minOut, traderProtection);
        });
    }

    /**
     * Chains swaps, each hop's output feeding the next hop. Intermediate tokens
     * net to zero in the session ledger, so only the first input and the last
     * output are transferred.
     */
    public BigInteger batchSwap(Address caller, List<SwapHop> hops, BigInteger amountIn, BigInteger minOut) {
        return call(() -> {
            if (hops == null || hops.isEmpty())
                throw new ConfigurationException(ErrorCode.INVALID_HOP, "Batch swap needs at least one hop");
            requirePositive(amountIn, "amountIn");
            Address user = beneficiary(caller);
            BridgeCache cache = new BridgeCache();
            Set<Address> touched = new LinkedHashSet<>();

            BigInteger current = amountIn;
            Address previousOut = null;
            for (int i = 0; i < hops.size(); i++) {
                SwapHop hop = hops.get(i);
                if (hop.markings().isEmpty())
                    throw new ConfigurationException(ErrorCode.INVALID_HOP, "Hop " + i + " names no marking");
                PoolKey first = PoolIdentity.canonicalKey(hop.assetA(), hop.assetB(), hop.strategy(),
                        hop.markings().get(0));
                Address tokenIn = first.tokenIn(hop.zeroForOne());
                if (previousOut != null && !previousOut.equals(tokenIn))
                    throw new ConfigurationException(ErrorCode.INVALID_HOP,
                            "Hop " + i + " sends " + tokenIn + " but previous hop produced " + previousOut);
                touched.add(tokenIn);
                touched.add(first.tokenOut(hop.zeroForOne()));

                if (!hop.isSplit()) {
                    current = executeLeg(first, user, current, hop.zeroForOne(), BigInteger.ZERO, cache);
                } else {
                    current = executeSplit(hop, i == 0, user, current, cache);
                }
                previousOut = first.tokenOut(hop.zeroForOne());
            }

            BigInteger out = current;
            if (out.compareTo(orZero(minOut)) < 0)
                throw new SlippageException(ErrorCode.SLIPPAGE_VIOLATION,
                        "Batch output " + out + " below minimum " + minOut);
            settleIfNoSession(user, touched);
            log.debug("Batch swap of {} hops: {} -> {} ({} bridge fetches)", hops.size(), amountIn, out,
                    cache.fetchCount());
            return out;
        });
    }

    /** Read-only quote against current inventory. Returns zero when no price is available. */
    public Quote quote(Address assetIn, Address assetOut, Address strategy, int marking, BigInteger amountIn) {
        return call(() -> {
            PoolKey key = PoolIdentity.canonicalKey(assetIn, assetOut, strategy, marking);
            PoolId id = requireCreated(key);
            boolean zeroForOne = key.asset0().equals(assetIn);
            try (ReentrancyGuard.Scope ignored = guard.enter(id)) {
                PoolState state = inventory.getPoolState(id);
                QuoteParams params = new QuoteParams(key.asset0(), key.asset1(), key.strategy(), amountIn,
                        state.reserve0(), state.reserve1(), key.decodedMarking(), zeroForOne);
                return router.getQuote(params, new BridgeCache(), false);
            }
        });
    }

    // ── Flash sessions ────────────────────────────────────────────

    public Map<Address, BigInteger> flashSession(Address caller, FlashCallback callback, byte[] data,
            Collection<Address> tokens) {
        return flashSession(caller, callback, data, tokens, BigInteger.ZERO);
    }

    /**
     * Opens a session for {@code caller}, runs the callback, settles every token
     * in {@code tokens} and closes the session.
     *
     * {@code nativeValue} is pulled into custody up front and netted against the
     * native-token delta at settlement; any surplus is refunded.
     *
     * @return the settlement transfers, positive amounts paid to the caller
     * @throws com.trading.amm.error.SessionException {@code SESSION_ALREADY_ACTIVE}
     *         on a nested start for the same owner, {@code UNSETTLED_DELTAS} when
     *         a touched token was left out of {@code tokens}
     */
    public Map<Address, BigInteger> flashSession(Address caller, FlashCallback callback, byte[] data,
            Collection<Address> tokens, BigInteger nativeValue) {
        Objects.requireNonNull(callback, "callback");
        return call(() -> {
            session.startSession(caller);
            BigInteger supplied = orZero(nativeValue);
            if (supplied.signum() > 0)
                transfers.pull(caller, Address.NATIVE, supplied);
            Address previous = session.getActiveUser();
            session.setActiveUser(caller);
            log.info("Flash session opened for {}", caller);

            callback.onFlashSession(this, caller, data == null ? new byte[0] : data);

            Map<Address, BigInteger> settled;
            try (ReentrancyGuard.Scope ignored = guard.enter(new SessionResource(caller))) {
                settled = session.settle(caller, tokens == null ? List.of() : tokens, supplied, transfers);
                session.endSession(caller);
            }
            session.setActiveUser(previous);
            int n = settled.size();
            emit(() -> listener.onSessionSettled(caller, n));
            log.info("Flash session settled for {}: {} transfer(s)", caller, n);
            return settled;
        });
    }

    public boolean isSessionActive(Address owner) {
        return session.isSessionActive(owner);
    }

    /** Pending delta of {@code user} in {@code token}; positive is owed to the user. */
    public BigInteger pendingDelta(Address user, Address token) {
        return session.getDelta(user, token);
    }

    // ── Commit-reveal ─────────────────────────────────────────────

    public void commit(Address caller, byte[] commitmentHash) {
        call(() -> {
            commitReveal.commit(caller, commitmentHash, block.blockNumber());
            return null;
        });
    }

    /** Verifies and consumes the caller's commitment, then runs the committed swap. */
    public BigInteger revealCommitted(Address caller, SwapIntent intent, long nonce, byte[] salt) {
        return call(() -> {
            commitReveal.reveal(caller, intent, nonce, salt, block.blockNumber());
            PoolKey key = PoolIdentity.canonicalKey(intent.assetA(), intent.assetB(), intent.strategy(),
                    intent.marking());
            return swapInternal(caller, key, intent.amountIn(), intent.zeroForOne(), intent.minOut(), 0);
        });
    }

    public long getCommitNonce(Address trader) {
        return commitReveal.nonce(trader);
    }

    public long revealDeadline(Address trader) {
        return commitReveal.revealDeadline(trader);
    }

    // ── Administration ────────────────────────────────────────────

    public void configureProtocolFee(Address treasury, int bps) {
        protocolFee = ProtocolFeeConfig.of(treasury, bps);
        log.info("Protocol fee set to {} bps, treasury {}", bps, treasury);
    }

    public ProtocolFeeConfig protocolFee() {
        return protocolFee;
    }

    public void configurePoolFeatures(PoolId id, Set<PoolFeature> features) {
        requirePool(id);
        Set<PoolFeature> copy = features == null || features.isEmpty() ? EnumSet.noneOf(PoolFeature.class)
                : EnumSet.copyOf(features);
        poolFeatures.put(id, copy);
        log.info("Pool features for {}: {}", id, copy);
    }

    public Set<PoolFeature> poolFeatures(PoolId id) {
        Set<PoolFeature> f = poolFeatures.get(id);
        return f == null ? Collections.emptySet() : Collections.unmodifiableSet(f);
    }

    public void setEmergencyBatchMode(int mode) {
        atomicExecution.setEmergencyMode(mode);
    }

    public int emergencyBatchMode() {
        return atomicExecution.emergencyMode();
    }

    public BridgeRegistry bridges() {
        return bridges;
    }

    public StrategyRegistry strategies() {
        return strategies;
    }

    public BigInteger volumeOf(Address trader, PoolId id) {
        return volumeControl.volumeOf(trader, id);
    }

    // ── Internals ─────────────────────────────────────────────────

    private BigInteger swapInternal(Address caller, PoolKey key, BigInteger amountIn, boolean zeroForOne,
            BigInteger minOut, int traderProtection) {
        PoolId id = requireCreated(key);
        requirePositive(amountIn, "amountIn");
        Address user = beneficiary(caller);

        if (traderProtection != 0 || atomicExecution.emergencyMode() != 0) {
            TraderProtection p = TraderProtection.decode(traderProtection);
            atomicExecution.check(p, session.isSessionActive(user), block.blockNumber());
            Set<PoolFeature> features = poolFeatures(id);
            accessControl.check(user, id, features, p);
            circuitBreaker.check(id, features, p);
            volumeControl.checkAndRecord(user, id, features, p, amountIn);
        }

        BigInteger out = executeLeg(key, user, amountIn, zeroForOne, orZero(minOut), new BridgeCache());
        settleIfNoSession(user, List.of(key.tokenIn(zeroForOne), key.tokenOut(zeroForOne)));
        return out;
    }

    /** Quotes and applies one pool leg under the pool's guard. */
    private BigInteger executeLeg(PoolKey key, Address user, BigInteger amountIn, boolean zeroForOne,
            BigInteger minOut, BridgeCache cache) {
        PoolId id = requireCreated(key);
        try (ReentrancyGuard.Scope ignored = guard.enter(id)) {
            PoolState state = requireLiquidity(id, key);
            QuoteParams params = new QuoteParams(key.asset0(), key.asset1(), key.strategy(), amountIn,
                    state.reserve0(), state.reserve1(), key.decodedMarking(), zeroForOne);
            Quote q = router.getQuote(params, cache, session.isSessionActive(user));
            return applyLeg(id, key, state, user, amountIn, q.amountOut(), zeroForOne, minOut);
        }
    }

    /**
     * Fans a hop's input across its bucket variants and prices them in a single
     * strategy batch call.
     */
    private BigInteger executeSplit(SwapHop hop, boolean firstHop, Address user, BigInteger input,
            BridgeCache cache) {
        Map<Integer, BigInteger> legs = splitAmounts(hop, firstHop, input);

        List<PoolKey> keys = new ArrayList<>();
        List<PoolId> ids = new ArrayList<>();
        List<BigInteger> amounts = new ArrayList<>();
        for (Map.Entry<Integer, BigInteger> e : legs.entrySet()) {
            if (e.getValue().signum() == 0)
                continue;
            PoolKey key = PoolIdentity.canonicalKey(hop.assetA(), hop.assetB(), hop.strategy(), e.getKey());
            keys.add(key);
            ids.add(requireCreated(key));
            amounts.add(e.getValue());
        }
        if (keys.isEmpty())
            throw new ConfigurationException(ErrorCode.INVALID_HOP, "Split hop routes nothing");

        List<ReentrancyGuard.Scope> scopes = new ArrayList<>(ids.size());
        try {
            List<PoolState> states = new ArrayList<>(ids.size());
            List<QuoteParams> params = new ArrayList<>(ids.size());
            for (int i = 0; i < ids.size(); i++) {
                scopes.add(guard.enter(ids.get(i)));
                PoolKey key = keys.get(i);
                PoolState state = requireLiquidity(ids.get(i), key);
                states.add(state);
                params.add(new QuoteParams(key.asset0(), key.asset1(), key.strategy(), amounts.get(i),
                        state.reserve0(), state.reserve1(), key.decodedMarking(), hop.zeroForOne()));
            }
            BigInteger[] quotes = router.getQuoteBatch(params, cache, session.isSessionActive(user));

            BigInteger total = BigInteger.ZERO;
            for (int i = 0; i < ids.size(); i++) {
                total = total.add(applyLeg(ids.get(i), keys.get(i), states.get(i), user, amounts.get(i), quotes[i],
                        hop.zeroForOne(), BigInteger.ZERO));
            }
            return total;
        } finally {
            for (int i = scopes.size() - 1; i >= 0; i--)
                scopes.get(i).close();
        }
    }

    /** Per-marking input amounts, duplicates merged, in first-seen order. */
    private static Map<Integer, BigInteger> splitAmounts(SwapHop hop, boolean firstHop, BigInteger input) {
        List<Integer> markings = hop.markings();
        List<BigInteger> amounts = hop.amounts();
        Map<Integer, BigInteger> legs = new LinkedHashMap<>();

        if (firstHop) {
            if (amounts.size() != markings.size())
                throw new ConfigurationException(ErrorCode.INVALID_HOP,
                        markings.size() + " markings but " + amounts.size() + " amounts");
            BigInteger sum = BigInteger.ZERO;
            for (int i = 0; i < markings.size(); i++) {
                BigInteger a = amounts.get(i);
                if (a.signum() < 0)
                    throw new ConfigurationException(ErrorCode.INVALID_HOP, "Negative bucket amount");
                sum = sum.add(a);
                legs.merge(markings.get(i) & MarkingCodec.WORD_MASK, a, BigInteger::add);
            }
            if (sum.compareTo(input) != 0)
                throw new ConfigurationException(ErrorCode.INVALID_HOP,
                        "Bucket amounts sum to " + sum + ", expected " + input);
            return legs;
        }

        List<BigInteger> weights = amounts;
        if (weights.isEmpty()) {
            weights = new ArrayList<>(Collections.nCopies(markings.size(), BigInteger.ONE));
        } else if (weights.size() != markings.size()) {
            throw new ConfigurationException(ErrorCode.INVALID_HOP,
                    markings.size() + " markings but " + weights.size() + " weights");
        }
        BigInteger totalWeight = BigInteger.ZERO;
        for (BigInteger w : weights) {
            if (w.signum() < 0)
                throw new ConfigurationException(ErrorCode.INVALID_HOP, "Negative bucket weight");
            totalWeight = totalWeight.add(w);
        }
        if (totalWeight.signum() == 0)
            throw new ConfigurationException(ErrorCode.INVALID_HOP, "Bucket weights sum to zero");

        BigInteger allocated = BigInteger.ZERO;
        for (int i = 0; i < markings.size(); i++) {
            // last bucket takes the rounding remainder
            BigInteger share = i == markings.size() - 1 ? input.subtract(allocated)
                    : UintMath.mulDiv(input, weights.get(i), totalWeight);
            allocated = allocated.add(share);
            legs.merge(markings.get(i) & MarkingCodec.WORD_MASK, share, BigInteger::add);
        }
        return legs;
    }

    private BigInteger applyLeg(PoolId id, PoolKey key, PoolState state, Address user, BigInteger amountIn,
            BigInteger amountOut, boolean zeroForOne, BigInteger minOut) {
        if (amountOut.signum() == 0)
            throw new QuoteUnavailableException(ErrorCode.QUOTE_UNAVAILABLE, "No price for " + amountIn + " on " + key);
        BigInteger reserveOut = state.reserve(!zeroForOne);
        if (amountOut.compareTo(reserveOut) >= 0)
            throw new LiquidityException(ErrorCode.INSUFFICIENT_RESERVES,
                    "Quote " + amountOut + " would drain reserve " + reserveOut + " of " + key);
        if (amountOut.compareTo(minOut) < 0)
            throw new SlippageException(ErrorCode.SLIPPAGE_VIOLATION,
                    "Output " + amountOut + " below minimum " + minOut);

        if (zeroForOne)
            inventory.applyDelta(id, amountIn, amountOut.negate());
        else
            inventory.applyDelta(id, amountOut.negate(), amountIn);

        session.addDelta(user, key.tokenIn(zeroForOne), amountIn.negate());
        session.addDelta(user, key.tokenOut(zeroForOne), amountOut);
        emit(() -> listener.onSwap(id, user, zeroForOne, amountIn, amountOut));
        if (log.isDebugEnabled())
            log.debug("Swap {} {} -> {} {} for {} on {}", amountIn, key.tokenIn(zeroForOne), amountOut,
                    key.tokenOut(zeroForOne), user, key);
        return amountOut;
    }

    /**
     * Takes the protocol's cut of the profit made since the last liquidity event.
     *
     * Both the baseline and the current reserves are valued in asset-0 terms at
     * the exchange rate recorded with the baseline, so trades that hand value to
     * traders read as a loss and pay nothing, in either direction. The fee is
     * paid in both assets, pro rata to the current reserves.
     */
    private PoolState chargeProtocolFee(PoolId id, PoolKey key, PoolState state) {
        if (!protocolFee.enabled() || state.isEmpty())
            return state;
        BigInteger base0 = state.feeBaseline0();
        BigInteger base1 = state.feeBaseline1();
        BigInteger value = valueAt(state.reserve0(), state.reserve1(), base0, base1);
        BigInteger baseline = valueAt(base0, base1, base0, base1);
        if (value.signum() == 0 || value.compareTo(baseline) <= 0)
            return state;

        BigInteger feeValue = UintMath.mulDiv(value.subtract(baseline), BigInteger.valueOf(protocolFee.bps()),
                UintMath.BPS);
        BigInteger fee0 = UintMath.mulDiv(state.reserve0(), feeValue, value);
        BigInteger fee1 = UintMath.mulDiv(state.reserve1(), feeValue, value);
        if (fee0.signum() == 0 && fee1.signum() == 0)
            return state;

        inventory.applyDelta(id, fee0.negate(), fee1.negate());
        Address treasury = protocolFee.treasury();
        if (fee0.signum() > 0)
            transfers.push(treasury, key.asset0(), fee0);
        if (fee1.signum() > 0)
            transfers.push(treasury, key.asset1(), fee1);
        emit(() -> listener.onProtocolFee(id, treasury, fee0, fee1));
        log.debug("Protocol fee ({}, {}) to {} on {}", fee0, fee1, treasury, key);
        return inventory.getPoolState(id);
    }

    /** {@code r0 + r1 * rate0 / rate1}: both reserves in asset-0 terms at the rate {@code rate1 : rate0}. */
    static BigInteger valueAt(BigInteger r0, BigInteger r1, BigInteger rate0, BigInteger rate1) {
        if (rate1.signum() == 0)
            return r0;
        return r0.add(UintMath.mulDiv(r1, rate0, rate1));
    }

    private void settleIfNoSession(Address user, Collection<Address> tokens) {
        if (session.isSessionActive(user))
            return;
        try (ReentrancyGuard.Scope ignored = guard.enter(new SessionResource(user))) {
            session.settle(user, tokens, BigInteger.ZERO, transfers);
        }
    }

    private Address beneficiary(Address caller) {
        Address active = session.getActiveUser();
        if (active != null && session.isSessionActive(active))
            return active;
        return Objects.requireNonNull(caller, "caller");
    }

    private PoolId requireCreated(PoolKey key) {
        PoolId id = PoolIdentity.assemble(key);
        if (!pools.containsKey(id))
            throw new ConfigurationException(ErrorCode.POOL_NOT_FOUND, "Pool not found: " + key);
        return id;
    }

    private PoolKey requirePool(PoolId id) {
        PoolKey key = pools.get(id);
        if (key == null)
            throw new ConfigurationException(ErrorCode.POOL_NOT_FOUND, "Pool not found: " + id.toHex());
        return key;
    }

    private PoolState requireLiquidity(PoolId id, PoolKey key) {
        PoolState state = inventory.getPoolState(id);
        if (state.isEmpty())
            throw new LiquidityException(ErrorCode.NO_LIQUIDITY, "Pool has no liquidity: " + key);
        return state;
    }

    private static void requirePositive(BigInteger v, String what) {
        if (!UintMath.isPositive(v))
            throw new ConfigurationException(ErrorCode.INVALID_AMOUNT, what + " must be positive: " + v);
    }

    private static BigInteger orZero(BigInteger v) {
        return v == null ? BigInteger.ZERO : v;
    }

    /** Runs a top-level call atomically and delivers its events once it commits. */
    private <T> T call(Supplier<T> work) {
        boolean outermost = !journal.inTransaction();
        T result = journal.atomically(work);
        if (outermost)
            flushEvents();
        return result;
    }

    private void emit(Runnable event) {
        pendingEvents.add(event);
        journal.record(() -> pendingEvents.remove(pendingEvents.size() - 1));
    }

    private void flushEvents() {
        if (pendingEvents.isEmpty())
            return;
        List<Runnable> batch = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        for (Runnable r : batch) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.error("Engine listener failed", e);
            }
        }
    }

    private record SessionResource(Address owner) {
    }
}
