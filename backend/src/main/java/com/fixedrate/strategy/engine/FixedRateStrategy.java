package com.fixedrate.strategy.engine;

import com.fixedrate.common.NonReentrantLock;
import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyOperation;
import com.fixedrate.domain.StrategyState;
import com.fixedrate.strategy.StrategyException;
import com.fixedrate.strategy.access.AccessPolicy;
import com.fixedrate.strategy.event.DepositEvent;
import com.fixedrate.strategy.event.FixedRateUpdatedEvent;
import com.fixedrate.strategy.event.HarvestDelayUpdateScheduledEvent;
import com.fixedrate.strategy.event.HarvestDelayUpdatedEvent;
import com.fixedrate.strategy.event.HarvestEvent;
import com.fixedrate.strategy.event.InitializedEvent;
import com.fixedrate.strategy.event.ProfitClaimedEvent;
import com.fixedrate.strategy.event.StrategyEvent;
import com.fixedrate.strategy.event.WithdrawalDelayUpdatedEvent;
import com.fixedrate.strategy.event.WithdrawalEvent;
import com.fixedrate.venue.AssetToken;
import com.fixedrate.venue.YieldVenue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fixed-rate strategy for one (asset, venue) pair: pools depositors' asset, delegates it to the venue and on each
 * harvest mints the yield above the fixed rate to the fee account (the strategy's own address).
 * <p>
 * Every mutating call runs under a {@link NonReentrantLock}: re-entry from a collaborator callback fails with
 * REENTRANT_CALL, calls from other threads queue. A call that throws restores the state it started from; events
 * are published only once the call has committed.
 */
@Slf4j
public class FixedRateStrategy {

    public static final long MAX_HARVEST_DELAY_SECONDS = 365L * 24 * 60 * 60;

    private final AccountId address;
    private final AssetToken asset;
    private final YieldVenue venue;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final StrategyState state = new StrategyState();
    private final NonReentrantLock lock = new NonReentrantLock();
    private final CompensationJournal compensations = new CompensationJournal();
    private final CapitalRouter capitalRouter;
    private final ShareLedger shareLedger;
    private final HarvestEngine harvestEngine;

    public FixedRateStrategy(AccountId address, AssetToken asset, YieldVenue venue, AccessPolicy accessPolicy,
                             ApplicationEventPublisher eventPublisher, Clock clock) {
        this.address = address;
        this.asset = asset;
        this.venue = venue;
        this.accessPolicy = accessPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.capitalRouter = new CapitalRouter(state, address, asset, venue, compensations);
        this.shareLedger = new ShareLedger(state, capitalRouter);
        this.harvestEngine = new HarvestEngine(state, shareLedger, capitalRouter, address);
    }

    /**
     * Opens deposits and starts the harvest clock. Allowed once.
     *
     * @throws StrategyException ALREADY_INITIALIZED on a second call; ZERO_DELAY when no harvest delay is set
     */
    public void initialize(AccountId caller) {
        execute(caller, StrategyOperation.INITIALIZE, events -> {
            if (state.isInitialized()) {
                throw new StrategyException(StrategyException.ALREADY_INITIALIZED, "Strategy already initialized");
            }
            if (state.getHarvestDelaySeconds() == 0) {
                throw new StrategyException(StrategyException.ZERO_DELAY, "Harvest delay must be set before initialization");
            }
            Instant now = clock.instant();
            state.setInitialized(true);
            state.setTotalShares(BigInteger.ZERO);
            state.setLastHarvestTimestamp(now.getEpochSecond());
            events.add(new InitializedEvent(this, address, caller, now, now.getEpochSecond()));
            log.info("Strategy {} initialized by {}", address, caller);
            return null;
        });
    }

    public void setWithdrawalDelay(AccountId caller, long seconds) {
        execute(caller, StrategyOperation.SET_WITHDRAWAL_DELAY, events -> {
            requireNonNegative(seconds, "withdrawal delay");
            state.setWithdrawalDelaySeconds(seconds);
            events.add(new WithdrawalDelayUpdatedEvent(this, address, caller, clock.instant(), seconds));
            log.info("Withdrawal delay set to {}s by {}", seconds, caller);
            return null;
        });
    }

    public void setFixedRate(AccountId caller, BigInteger ratePerSecond) {
        execute(caller, StrategyOperation.SET_FIXED_RATE, events -> {
            if (ratePerSecond == null || ratePerSecond.signum() < 0) {
                throw new StrategyException(StrategyException.INVALID_AMOUNT, "Fixed rate must be non-negative");
            }
            state.setFixedRatePerSecond(ratePerSecond);
            events.add(new FixedRateUpdatedEvent(this, address, caller, clock.instant(), ratePerSecond));
            log.info("Fixed rate set to {} per second by {}", ratePerSecond, caller);
            return null;
        });
    }

    /**
     * Sets the harvest delay. Applies immediately the first time; afterwards the change is staged and takes effect
     * when the next harvest completes, so it cannot shorten the cycle in progress.
     *
     * @throws StrategyException ZERO_DELAY for 0; DELAY_TOO_LONG above one year
     */
    public void setHarvestDelay(AccountId caller, long seconds) {
        execute(caller, StrategyOperation.SET_HARVEST_DELAY, events -> {
            requireNonNegative(seconds, "harvest delay");
            if (seconds == 0) {
                throw new StrategyException(StrategyException.ZERO_DELAY, "Harvest delay must be non-zero");
            }
            if (seconds > MAX_HARVEST_DELAY_SECONDS) {
                throw new StrategyException(StrategyException.DELAY_TOO_LONG,
                        "Harvest delay " + seconds + "s exceeds " + MAX_HARVEST_DELAY_SECONDS + "s");
            }
            Instant now = clock.instant();
            if (state.getHarvestDelaySeconds() == 0) {
                state.setHarvestDelaySeconds(seconds);
                events.add(new HarvestDelayUpdatedEvent(this, address, caller, now, seconds));
                log.info("Harvest delay set to {}s by {}", seconds, caller);
            } else {
                state.setPendingHarvestDelaySeconds(seconds);
                events.add(new HarvestDelayUpdateScheduledEvent(this, address, caller, now, seconds));
                log.info("Harvest delay {}s scheduled by {} for next harvest", seconds, caller);
            }
            return null;
        });
    }

    /**
     * Pulls {@code amount} from the caller, credits shares (rounded down) and delegates the amount to the venue.
     * Resets the caller's withdrawal lock.
     *
     * @return shares minted
     * @throws StrategyException ZERO_AMOUNT, NOT_INITIALIZED, ZERO_SHARES for dust, TRANSFER_FAILED
     */
    public BigInteger deposit(AccountId caller, BigInteger amount) {
        return execute(caller, null, events -> {
            requirePositive(amount);
            requireInitialized();
            Instant now = clock.instant();
            BigInteger shares = shareLedger.sharesForAssets(amount);
            if (shares.signum() == 0) {
                throw new StrategyException(StrategyException.ZERO_SHARES, "Deposit of " + amount + " mints zero shares");
            }
            if (!asset.transferFrom(caller, address, amount)) {
                throw new StrategyException(StrategyException.TRANSFER_FAILED,
                        "Asset refused transferFrom " + caller + " of " + amount);
            }
            compensations.record("refund " + amount + " to " + caller, () -> capitalRouter.payOut(caller, amount));
            shareLedger.mint(caller, shares);
            state.account(caller).setLastDepositTimestamp(now.getEpochSecond());
            capitalRouter.delegate(amount);
            events.add(new DepositEvent(this, address, caller, now, amount, shares));
            log.debug("Deposit {} by {} -> {} shares", amount, caller, shares);
            return shares;
        });
    }

    /**
     * Burns shares for {@code amount} (rounded up), retrieves the asset and pays it out. The payout can fall short
     * of {@code amount} when the venue returns less than asked.
     *
     * @return asset paid to the caller
     * @throws StrategyException ZERO_AMOUNT, WITHDRAWAL_TOO_SOON, INSUFFICIENT_SHARES, TRANSFER_FAILED
     */
    public BigInteger withdraw(AccountId caller, BigInteger amount) {
        return execute(caller, null, events -> {
            requirePositive(amount);
            requireInitialized();
            Instant now = clock.instant();
            long sinceDeposit = now.getEpochSecond() - state.lastDepositTimestampOf(caller);
            if (sinceDeposit < state.getWithdrawalDelaySeconds()) {
                throw new StrategyException(StrategyException.WITHDRAWAL_TOO_SOON,
                        "Withdrawal allowed at " + withdrawableAt(caller) + ", now " + now.getEpochSecond());
            }
            BigInteger shares = shareLedger.sharesToBurn(amount);
            shareLedger.burn(caller, shares);
            BigInteger retrieved = capitalRouter.retrieve(amount);
            capitalRouter.payOut(caller, retrieved);
            events.add(new WithdrawalEvent(this, address, caller, now, amount, shares, retrieved));
            log.debug("Withdraw {} by {}: burned {} shares, paid {}", amount, caller, shares, retrieved);
            return retrieved;
        });
    }

    /**
     * Splits venue yield between depositors (fixed rate) and the fee account (surplus).
     *
     * @throws StrategyException UNAUTHORIZED, NOT_INITIALIZED, HARVEST_TOO_SOON
     */
    public HarvestReport harvest(AccountId caller) {
        return execute(caller, StrategyOperation.HARVEST, events -> {
            Instant now = clock.instant();
            HarvestReport report = harvestEngine.harvest(now.getEpochSecond());
            events.add(new HarvestEvent(this, address, caller, now, report.observedVenueValue(), report.realProfit(),
                    report.expectedProfit(), report.surplus(), report.feeShares(), report.loss(),
                    report.harvestDelaySeconds()));
            if (report.harvestDelayRolledOver()) {
                events.add(new HarvestDelayUpdatedEvent(this, address, caller, now, report.harvestDelaySeconds()));
            }
            log.info("Harvest by {}: venue value {}, real profit {}, expected {}, fee shares {}",
                    caller, report.observedVenueValue(), report.realProfit(), report.expectedProfit(), report.feeShares());
            return report;
        });
    }

    /**
     * Redeems the fee account's whole share balance and pays the asset to the caller.
     *
     * @return asset paid to the caller
     * @throws StrategyException UNAUTHORIZED; ZERO_AMOUNT when there is nothing to claim
     */
    public BigInteger claimProfit(AccountId caller) {
        return execute(caller, StrategyOperation.CLAIM_PROFIT, events -> {
            BigInteger feeShares = shareLedger.balanceOf(address);
            if (feeShares.signum() == 0) {
                throw new StrategyException(StrategyException.ZERO_AMOUNT, "No protocol profit to claim");
            }
            BigInteger assets = shareLedger.assetsForShares(feeShares);
            shareLedger.burn(address, feeShares);
            BigInteger retrieved = capitalRouter.retrieve(assets);
            capitalRouter.payOut(caller, retrieved);
            events.add(new ProfitClaimedEvent(this, address, caller, clock.instant(), feeShares, retrieved));
            log.info("Profit claimed by {}: {} fee shares -> {}", caller, feeShares, retrieved);
            return retrieved;
        });
    }

    public AccountId getAddress() {
        return address;
    }

    public BigInteger totalHoldings() {
        return lock.read(shareLedger::totalHoldings);
    }

    public BigInteger totalFloat() {
        return lock.read(capitalRouter::totalFloat);
    }

    public BigInteger totalShares() {
        return lock.read(state::getTotalShares);
    }

    public BigInteger totalDelegatedHoldings() {
        return lock.read(state::getTotalDelegatedHoldings);
    }

    public BigInteger balanceOf(AccountId account) {
        return lock.read(() -> shareLedger.balanceOf(account));
    }

    public BigInteger balanceOfUnderlying(AccountId account) {
        return lock.read(() -> shareLedger.assetsForShares(shareLedger.balanceOf(account)));
    }

    public BigInteger convertToShares(BigInteger assetAmount) {
        return lock.read(() -> shareLedger.sharesForAssets(assetAmount));
    }

    public BigInteger convertToUnderlying(BigInteger shareAmount) {
        return lock.read(() -> shareLedger.assetsForShares(shareAmount));
    }

    public BigInteger getVenueBalanceOfUnderlying() {
        return lock.read(capitalRouter::venueBalanceOfUnderlying);
    }

    public boolean isInitialized() {
        return lock.read(state::isInitialized);
    }

    public long lastDepositTimestamp(AccountId account) {
        return lock.read(() -> state.lastDepositTimestampOf(account));
    }

    public long nextHarvestAt() {
        return lock.read(harvestEngine::nextHarvestAt);
    }

    public boolean isHarvestDue() {
        return lock.read(() -> harvestEngine.isDue(clock.instant().getEpochSecond()));
    }

    /** Share balance of every account that ever held shares, fee account included. */
    public Map<AccountId, BigInteger> shareBalances() {
        return lock.read(() -> {
            Map<AccountId, BigInteger> balances = new HashMap<>();
            state.accountsView().forEach((id, record) -> balances.put(id, record.getShareBalance()));
            return balances;
        });
    }

    public AccountPosition accountPosition(AccountId account) {
        return lock.read(() -> {
            BigInteger shares = shareLedger.balanceOf(account);
            return new AccountPosition(account.value(), shares, shareLedger.assetsForShares(shares),
                    state.lastDepositTimestampOf(account), withdrawableAt(account));
        });
    }

    public StrategySnapshot snapshot() {
        return lock.read(() -> new StrategySnapshot(
                address.value(),
                asset.id().value(),
                venue.id().value(),
                state.isInitialized(),
                state.getTotalShares(),
                shareLedger.totalHoldings(),
                capitalRouter.totalFloat(),
                state.getTotalDelegatedHoldings(),
                capitalRouter.venueBalanceOfUnderlying(),
                shareLedger.balanceOf(address),
                state.getFixedRatePerSecond(),
                state.getWithdrawalDelaySeconds(),
                state.getHarvestDelaySeconds(),
                state.getPendingHarvestDelaySeconds(),
                state.getLastHarvestTimestamp(),
                harvestEngine.nextHarvestAt()));
    }

    private <T> T execute(AccountId caller, StrategyOperation privileged, Function<List<StrategyEvent>, T> action) {
        if (!lock.tryEnter()) {
            throw new StrategyException(StrategyException.REENTRANT_CALL, "Re-entrant call into strategy " + address);
        }
        List<StrategyEvent> events = new ArrayList<>();
        T result;
        try {
            if (privileged != null && !accessPolicy.canCall(caller, privileged)) {
                throw new StrategyException(StrategyException.UNAUTHORIZED, caller + " may not call " + privileged);
            }
            StrategyState rollback = state.copy();
            compensations.clear();
            try {
                result = action.apply(events);
            } catch (RuntimeException e) {
                compensations.unwind(e);
                state.restoreFrom(rollback);
                throw e;
            }
            compensations.clear();
        } finally {
            lock.exit();
        }
        events.forEach(eventPublisher::publishEvent);
        return result;
    }

    /** Epoch second the withdrawal lock lifts; {@link Long#MAX_VALUE} when it never does. */
    private long withdrawableAt(AccountId account) {
        long lastDeposit = state.lastDepositTimestampOf(account);
        long delay = state.getWithdrawalDelaySeconds();
        return lastDeposit > Long.MAX_VALUE - delay ? Long.MAX_VALUE : lastDeposit + delay;
    }

    private void requireInitialized() {
        if (!state.isInitialized()) {
            throw new StrategyException(StrategyException.NOT_INITIALIZED, "Strategy not initialized");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() == 0) {
            throw new StrategyException(StrategyException.ZERO_AMOUNT, "Amount must be greater than zero");
        }
        if (amount.signum() < 0) {
            throw new StrategyException(StrategyException.INVALID_AMOUNT, "Amount must not be negative: " + amount);
        }
    }

    private static void requireNonNegative(long seconds, String what) {
        if (seconds < 0) {
            throw new StrategyException(StrategyException.INVALID_AMOUNT, what + " must not be negative: " + seconds);
        }
    }
}
