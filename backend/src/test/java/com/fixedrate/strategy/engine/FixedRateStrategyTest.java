package com.fixedrate.strategy.engine;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.StrategyException;
import com.fixedrate.strategy.access.OwnerAccessPolicy;
import com.fixedrate.strategy.event.DepositEvent;
import com.fixedrate.strategy.event.HarvestDelayUpdateScheduledEvent;
import com.fixedrate.strategy.event.HarvestDelayUpdatedEvent;
import com.fixedrate.strategy.event.HarvestEvent;
import com.fixedrate.strategy.event.StrategyEvent;
import com.fixedrate.strategy.event.WithdrawalEvent;
import com.fixedrate.venue.AssetToken;
import com.fixedrate.venue.VenueException;
import com.fixedrate.venue.YieldVenue;
import com.fixedrate.venue.simulation.SimulatedToken;
import com.fixedrate.venue.simulation.SimulatedYieldVenue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FixedRateStrategyTest {

    private static final AccountId STRATEGY = AccountId.of("0x5000000000000000000000000000000000000005");
    private static final AccountId ASSET = AccountId.of("0xa000000000000000000000000000000000000001");
    private static final AccountId VENUE = AccountId.of("0xb000000000000000000000000000000000000002");
    private static final AccountId OWNER = AccountId.of("0x0000000000000000000000000000000000000a11");
    private static final AccountId KEEPER = AccountId.of("0x00000000000000000000000000000000000000ee");
    private static final AccountId ALICE = AccountId.of("0x1111111111111111111111111111111111111111");
    private static final AccountId BOB = AccountId.of("0x2222222222222222222222222222222222222222");

    private static final long HARVEST_DELAY = 3600;
    private static final long WITHDRAWAL_DELAY = 600;
    /** 36 units of expected profit on 100 delegated over one harvest delay. */
    private static final BigInteger RATE_36_PER_CYCLE = new BigInteger("100000000000000");

    @Mock
    ApplicationEventPublisher eventPublisher;

    MutableClock clock;
    SimulatedToken token;
    SimulatedYieldVenue venue;
    FixedRateStrategy strategy;
    long startedAt;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        token = new SimulatedToken(ASSET);
        venue = new SimulatedYieldVenue(VENUE, token);
        strategy = newStrategy(token.connect(STRATEGY), venue.connect(STRATEGY));
        strategy.setHarvestDelay(OWNER, HARVEST_DELAY);
        strategy.setWithdrawalDelay(OWNER, WITHDRAWAL_DELAY);
        strategy.initialize(OWNER);
        startedAt = clock.epochSecond();
    }

    private FixedRateStrategy newStrategy(AssetToken asset, YieldVenue yieldVenue) {
        return new FixedRateStrategy(STRATEGY, asset, yieldVenue, new OwnerAccessPolicy(OWNER, Set.of(KEEPER)),
                eventPublisher, clock);
    }

    private void fund(AccountId account, long amount) {
        token.mint(account, n(amount));
        token.approve(account, STRATEGY, FixedPointMath.MAX_UINT256);
    }

    private static BigInteger n(long v) {
        return BigInteger.valueOf(v);
    }

    private static String errorCodeOf(Throwable t) {
        return ((StrategyException) t).getErrorCode();
    }

    @Test
    @DisplayName("deposit 100, empty harvest, withdraw 100: shares and payout stay 1:1")
    void depositHarvestWithdraw_roundTripsAtPar() {
        fund(ALICE, 100);

        assertThat(strategy.deposit(ALICE, n(100))).isEqualTo(n(100));
        assertThat(strategy.totalShares()).isEqualTo(n(100));
        assertThat(strategy.totalHoldings()).isEqualTo(n(100));
        assertThat(strategy.totalFloat()).isZero();
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(100));

        clock.advanceSeconds(HARVEST_DELAY);
        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.feeShares()).isZero();
        assertThat(report.realProfit()).isZero();
        assertThat(strategy.totalShares()).isEqualTo(n(100));
        assertThat(strategy.snapshot().lastHarvestTimestamp()).isEqualTo(startedAt + HARVEST_DELAY);

        BigInteger received = strategy.withdraw(ALICE, n(100));

        assertThat(received).isEqualTo(n(100));
        assertThat(strategy.totalShares()).isZero();
        assertThat(token.balanceOf(ALICE)).isEqualTo(n(100));
    }

    @Test
    @DisplayName("first deposit mints shares equal to the amount")
    void firstDeposit_isOneToOne() {
        fund(ALICE, 12_345);

        assertThat(strategy.deposit(ALICE, n(12_345))).isEqualTo(n(12_345));
        assertThat(strategy.balanceOf(ALICE)).isEqualTo(n(12_345));
        assertThat(strategy.balanceOfUnderlying(ALICE)).isEqualTo(n(12_345));
    }

    @Test
    @DisplayName("round trip at a non-trivial share price pays back no more than deposited")
    void roundTrip_atPremiumPrice_neverPaysMore() {
        strategy.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.accrueYield(n(33));
        clock.advanceSeconds(HARVEST_DELAY);
        assertThat(strategy.harvest(KEEPER).feeShares()).isZero();
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(133));

        fund(BOB, 50);
        BigInteger shares = strategy.deposit(BOB, n(50));
        assertThat(shares).isEqualTo(n(37));
        BigInteger owed = strategy.balanceOfUnderlying(BOB);
        assertThat(owed).isEqualTo(n(49));

        clock.advanceSeconds(WITHDRAWAL_DELAY);
        BigInteger received = strategy.withdraw(BOB, owed);

        assertThat(received).isLessThanOrEqualTo(n(50)).isEqualTo(n(48));
        assertThat(strategy.balanceOf(BOB)).isZero();
        assertThat(strategy.totalShares()).isEqualTo(n(100));
    }

    @Test
    @DisplayName("withdrawal fails one second before the lock expires and succeeds at the boundary")
    void withdrawalLock_boundary() {
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));

        clock.advanceSeconds(WITHDRAWAL_DELAY - 1);
        for (long amount : new long[]{1, 50, 100}) {
            assertThatThrownBy(() -> strategy.withdraw(ALICE, n(amount)))
                    .isInstanceOf(StrategyException.class)
                    .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.WITHDRAWAL_TOO_SOON));
        }

        clock.advanceSeconds(1);
        assertThat(strategy.withdraw(ALICE, n(1))).isEqualTo(n(1));
    }

    @Test
    @DisplayName("a top-up restarts the whole withdrawal lock")
    void topUp_restartsLock() {
        fund(ALICE, 200);
        strategy.deposit(ALICE, n(100));
        clock.advanceSeconds(300);
        strategy.deposit(ALICE, n(100));

        clock.advanceSeconds(300);
        assertThatThrownBy(() -> strategy.withdraw(ALICE, n(1)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.WITHDRAWAL_TOO_SOON));

        clock.advanceSeconds(300);
        assertThat(strategy.withdraw(ALICE, n(1))).isEqualTo(n(1));
    }

    @Test
    @DisplayName("harvest fails before the delay elapses and succeeds exactly at it")
    void harvestGate_boundary() {
        clock.advanceSeconds(HARVEST_DELAY - 1);
        assertThat(strategy.isHarvestDue()).isFalse();
        assertThatThrownBy(() -> strategy.harvest(KEEPER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.HARVEST_TOO_SOON));

        clock.advanceSeconds(1);
        assertThat(strategy.isHarvestDue()).isTrue();
        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.elapsedSeconds()).isEqualTo(HARVEST_DELAY);
        assertThat(strategy.nextHarvestAt()).isEqualTo(startedAt + 2 * HARVEST_DELAY);
    }

    @Test
    @DisplayName("yield above the fixed rate is minted to the fee account at the pre-harvest price")
    void harvest_surplusMintsFeeShares() {
        strategy.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.accrueYield(n(50));
        clock.advanceSeconds(HARVEST_DELAY);

        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.observedVenueValue()).isEqualTo(n(150));
        assertThat(report.expectedProfit()).isEqualTo(n(36));
        assertThat(report.surplus()).isEqualTo(n(14));
        assertThat(report.feeShares()).isEqualTo(n(14));
        assertThat(strategy.balanceOf(STRATEGY)).isEqualTo(n(14));
        assertThat(strategy.totalShares()).isEqualTo(n(114));
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(150));
    }

    @Test
    @DisplayName("yield at or below the fixed rate mints no fee shares")
    void harvest_belowFixedRate_noFee() {
        strategy.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.accrueYield(n(36));
        clock.advanceSeconds(HARVEST_DELAY);

        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.feeShares()).isZero();
        assertThat(strategy.totalShares()).isEqualTo(n(100));
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(136));
        assertThat(strategy.balanceOfUnderlying(ALICE)).isEqualTo(n(136));
    }

    @Test
    @DisplayName("venue loss is reported, takes no fee and lowers the share price")
    void harvest_venueLoss_clampsProfitAndResyncs() {
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.realizeLoss(n(10));
        clock.advanceSeconds(HARVEST_DELAY);

        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.realProfit()).isZero();
        assertThat(report.loss()).isEqualTo(n(10));
        assertThat(report.feeShares()).isZero();
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(90));
        assertThat(strategy.balanceOfUnderlying(ALICE)).isEqualTo(n(90));
    }

    @Test
    @DisplayName("claimProfit redeems every fee share and pays the owner")
    void claimProfit_paysOwner() {
        strategy.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.accrueYield(n(50));
        clock.advanceSeconds(HARVEST_DELAY);
        strategy.harvest(KEEPER);

        BigInteger received = strategy.claimProfit(OWNER);

        assertThat(received).isEqualTo(n(18));
        assertThat(token.balanceOf(OWNER)).isEqualTo(n(18));
        assertThat(strategy.balanceOf(STRATEGY)).isZero();
        assertThat(strategy.totalShares()).isEqualTo(n(100));
        assertThat(strategy.totalDelegatedHoldings()).isEqualTo(n(132));
    }

    @Test
    void claimProfit_withNothingAccrued_fails() {
        assertThatThrownBy(() -> strategy.claimProfit(OWNER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_AMOUNT));
    }

    @Test
    @DisplayName("a delay staged mid-cycle does not move the current harvest")
    void stagedHarvestDelay_appliesAfterNextHarvest() {
        clock.advanceSeconds(100);
        strategy.setHarvestDelay(OWNER, 60);

        assertThat(strategy.snapshot().harvestDelaySeconds()).isEqualTo(HARVEST_DELAY);
        assertThat(strategy.snapshot().pendingHarvestDelaySeconds()).isEqualTo(60);
        assertThat(strategy.isHarvestDue()).isFalse();

        clock.advanceSeconds(HARVEST_DELAY - 100);
        HarvestReport report = strategy.harvest(KEEPER);

        assertThat(report.harvestDelayRolledOver()).isTrue();
        assertThat(strategy.snapshot().harvestDelaySeconds()).isEqualTo(60);
        assertThat(strategy.snapshot().pendingHarvestDelaySeconds()).isZero();
        assertThat(strategy.nextHarvestAt()).isEqualTo(startedAt + HARVEST_DELAY + 60);
    }

    @Test
    void harvestDelay_rangeChecked() {
        assertThatThrownBy(() -> strategy.setHarvestDelay(OWNER, 0))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_DELAY));
        assertThatThrownBy(() -> strategy.setHarvestDelay(OWNER, FixedRateStrategy.MAX_HARVEST_DELAY_SECONDS + 1))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.DELAY_TOO_LONG));

        strategy.setHarvestDelay(OWNER, FixedRateStrategy.MAX_HARVEST_DELAY_SECONDS);
        assertThat(strategy.snapshot().pendingHarvestDelaySeconds())
                .isEqualTo(FixedRateStrategy.MAX_HARVEST_DELAY_SECONDS);
    }

    @Test
    @DisplayName("uninitialized engine holds the sentinel supply and refuses deposits")
    void uninitialized_refusesDeposits() {
        FixedRateStrategy fresh = newStrategy(token.connect(STRATEGY), venue.connect(STRATEGY));
        fund(ALICE, 10);

        assertThat(fresh.isInitialized()).isFalse();
        assertThat(fresh.totalShares()).isEqualTo(FixedPointMath.MAX_UINT256);
        assertThatThrownBy(() -> fresh.deposit(ALICE, n(10)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.NOT_INITIALIZED));
        assertThatThrownBy(() -> fresh.initialize(OWNER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_DELAY));
    }

    @Test
    void initialize_twice_fails() {
        assertThatThrownBy(() -> strategy.initialize(OWNER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ALREADY_INITIALIZED));
    }

    @Test
    @DisplayName("privileged calls are refused for callers the policy does not allow")
    void accessPolicy_enforced() {
        clock.advanceSeconds(HARVEST_DELAY);

        assertThatThrownBy(() -> strategy.harvest(ALICE))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.UNAUTHORIZED));
        assertThatThrownBy(() -> strategy.setFixedRate(KEEPER, n(1)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.UNAUTHORIZED));
        assertThatThrownBy(() -> strategy.claimProfit(KEEPER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.UNAUTHORIZED));

        strategy.harvest(KEEPER);
    }

    @Test
    void zeroAndNegativeAmounts_refused() {
        fund(ALICE, 10);
        assertThatThrownBy(() -> strategy.deposit(ALICE, BigInteger.ZERO))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_AMOUNT));
        assertThatThrownBy(() -> strategy.withdraw(ALICE, BigInteger.ZERO))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_AMOUNT));
        assertThatThrownBy(() -> strategy.deposit(ALICE, n(-5)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.INVALID_AMOUNT));
    }

    @Test
    @DisplayName("dust deposit that would mint zero shares is refused")
    void dustDeposit_refused() {
        strategy.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        venue.accrueYield(n(33));
        clock.advanceSeconds(HARVEST_DELAY);
        strategy.harvest(KEEPER);
        fund(BOB, 1);

        assertThatThrownBy(() -> strategy.deposit(BOB, n(1)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.ZERO_SHARES));
        assertThat(token.balanceOf(BOB)).isEqualTo(n(1));
    }

    @Test
    @DisplayName("asset refusing transferFrom fails the deposit with no state change")
    void deposit_transferRefused() {
        token.mint(ALICE, n(100));

        assertThatThrownBy(() -> strategy.deposit(ALICE, n(100)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.TRANSFER_FAILED));
        assertThat(strategy.totalShares()).isZero();
        assertThat(strategy.balanceOf(ALICE)).isZero();
        assertThat(strategy.lastDepositTimestamp(ALICE)).isZero();
    }

    @Test
    @DisplayName("venue failure during delegation rolls back shares and refunds the depositor")
    void deposit_venueFailure_rollsBack() {
        YieldVenue failingVenue = mock(YieldVenue.class);
        when(failingVenue.id()).thenReturn(VENUE);
        doThrow(new VenueException("venue paused")).when(failingVenue).deposit(any());
        FixedRateStrategy guarded = newStrategy(token.connect(STRATEGY), failingVenue);
        guarded.setHarvestDelay(OWNER, HARVEST_DELAY);
        guarded.initialize(OWNER);
        fund(ALICE, 100);

        assertThatThrownBy(() -> guarded.deposit(ALICE, n(100))).isInstanceOf(VenueException.class);

        assertThat(guarded.totalShares()).isZero();
        assertThat(guarded.balanceOf(ALICE)).isZero();
        assertThat(guarded.totalDelegatedHoldings()).isZero();
        assertThat(guarded.totalHoldings()).isZero();
        assertThat(token.balanceOf(ALICE)).isEqualTo(n(100));
        assertThat(token.balanceOf(STRATEGY)).isZero();
        assertThat(token.allowance(STRATEGY, VENUE)).isZero();
        verify(eventPublisher, never()).publishEvent(any(DepositEvent.class));
    }

    @Test
    @DisplayName("a refund the asset refuses is attached to the delegation failure")
    void deposit_venueFailure_refundRefused_surfacesSuppressed() {
        GatedToken gatedToken = new GatedToken(token.connect(STRATEGY));
        GatedVenue gatedVenue = new GatedVenue(venue.connect(STRATEGY));
        FixedRateStrategy gated = gatedStrategy(gatedToken, gatedVenue);
        fund(ALICE, 100);
        gatedVenue.depositsPaused = true;
        gatedToken.refusedRecipient = ALICE;

        assertThatThrownBy(() -> gated.deposit(ALICE, n(100)))
                .isInstanceOf(VenueException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).singleElement()
                        .satisfies(undo -> assertThat(errorCodeOf(undo)).isEqualTo(StrategyException.TRANSFER_FAILED)));

        assertThat(gated.totalShares()).isZero();
        assertThat(gated.totalDelegatedHoldings()).isZero();
        assertThat(token.balanceOf(STRATEGY)).isEqualTo(n(100));
    }

    @Test
    @DisplayName("payout refused after a venue pull puts the asset back in the venue and keeps the shares")
    void withdraw_payoutRefused_returnsPulledAssetToVenue() {
        GatedToken gatedToken = new GatedToken(token.connect(STRATEGY));
        FixedRateStrategy gated = gatedStrategy(gatedToken, venue.connect(STRATEGY));
        fund(ALICE, 100);
        gated.deposit(ALICE, n(100));
        clock.advanceSeconds(WITHDRAWAL_DELAY);
        gatedToken.refusedRecipient = ALICE;

        assertThatThrownBy(() -> gated.withdraw(ALICE, n(50)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.TRANSFER_FAILED));

        assertThat(gated.balanceOf(ALICE)).isEqualTo(n(100));
        assertThat(gated.totalShares()).isEqualTo(n(100));
        assertThat(gated.totalFloat()).isZero();
        assertThat(gated.totalDelegatedHoldings()).isEqualTo(n(100));
        assertThat(gated.totalHoldings()).isEqualTo(n(100));
        assertThat(gated.balanceOfUnderlying(ALICE)).isEqualTo(n(100));
        assertThat(venue.shareBalanceOf(STRATEGY)).isEqualTo(n(100));
        assertThat(venue.balance()).isEqualTo(n(100));
        assertThat(token.balanceOf(ALICE)).isZero();

        gatedToken.refusedRecipient = null;
        assertThat(gated.withdraw(ALICE, n(100))).isEqualTo(n(100));
        assertThat(token.balanceOf(ALICE)).isEqualTo(n(100));
    }

    @Test
    @DisplayName("profit payout refused keeps the fee shares and the venue position")
    void claimProfit_payoutRefused_keepsFeeShares() {
        GatedToken gatedToken = new GatedToken(token.connect(STRATEGY));
        FixedRateStrategy gated = gatedStrategy(gatedToken, venue.connect(STRATEGY));
        gated.setFixedRate(OWNER, RATE_36_PER_CYCLE);
        fund(ALICE, 100);
        gated.deposit(ALICE, n(100));
        venue.accrueYield(n(50));
        clock.advanceSeconds(HARVEST_DELAY);
        gated.harvest(KEEPER);
        gatedToken.refusedRecipient = OWNER;

        assertThatThrownBy(() -> gated.claimProfit(OWNER))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.TRANSFER_FAILED));

        assertThat(gated.balanceOf(STRATEGY)).isEqualTo(n(14));
        assertThat(gated.totalShares()).isEqualTo(n(114));
        assertThat(gated.totalFloat()).isZero();
        assertThat(gated.totalDelegatedHoldings()).isEqualTo(n(150));
        assertThat(gated.totalHoldings()).isEqualTo(n(150));
        assertThat(venue.shareBalanceOf(STRATEGY)).isEqualTo(n(100));
        assertThat(venue.balance()).isEqualTo(n(150));

        gatedToken.refusedRecipient = null;
        assertThat(gated.claimProfit(OWNER)).isEqualTo(n(18));
    }

    @Test
    @DisplayName("venue refusing a withdrawal leaves shares and holdings untouched")
    void withdraw_venueWithdrawalFails_keepsPosition() {
        GatedVenue gatedVenue = new GatedVenue(venue.connect(STRATEGY));
        FixedRateStrategy gated = gatedStrategy(token.connect(STRATEGY), gatedVenue);
        fund(ALICE, 100);
        gated.deposit(ALICE, n(100));
        clock.advanceSeconds(WITHDRAWAL_DELAY);
        gatedVenue.withdrawalsPaused = true;

        assertThatThrownBy(() -> gated.withdraw(ALICE, n(50))).isInstanceOf(VenueException.class);

        assertThat(gated.balanceOf(ALICE)).isEqualTo(n(100));
        assertThat(gated.totalDelegatedHoldings()).isEqualTo(n(100));
        assertThat(gated.totalHoldings()).isEqualTo(n(100));
        assertThat(venue.shareBalanceOf(STRATEGY)).isEqualTo(n(100));
        assertThat(token.balanceOf(ALICE)).isZero();
        verify(eventPublisher, never()).publishEvent(any(WithdrawalEvent.class));
    }

    @Test
    @DisplayName("a withdrawal delay near the long range never unlocks instead of wrapping around")
    void withdrawalDelay_huge_neverUnlocks() {
        strategy.setWithdrawalDelay(OWNER, Long.MAX_VALUE);
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        clock.advanceSeconds(10 * HARVEST_DELAY);

        assertThatThrownBy(() -> strategy.withdraw(ALICE, n(1)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.WITHDRAWAL_TOO_SOON));
        assertThat(strategy.accountPosition(ALICE).withdrawableAt()).isEqualTo(Long.MAX_VALUE);
        assertThat(strategy.balanceOf(ALICE)).isEqualTo(n(100));
    }

    @Test
    @DisplayName("a collaborator calling back into a guarded operation gets REENTRANT_CALL")
    void reentrantCallback_refused() {
        AtomicReference<FixedRateStrategy> target = new AtomicReference<>();
        AtomicReference<BigInteger> sharesSeenInCallback = new AtomicReference<>();
        AssetToken plain = token.connect(STRATEGY);
        AssetToken hostile = new AssetToken() {
            @Override
            public AccountId id() {
                return plain.id();
            }

            @Override
            public boolean transferFrom(AccountId from, AccountId to, BigInteger amount) {
                sharesSeenInCallback.set(target.get().totalShares());
                target.get().deposit(from, amount);
                return plain.transferFrom(from, to, amount);
            }

            @Override
            public boolean transfer(AccountId to, BigInteger amount) {
                return plain.transfer(to, amount);
            }

            @Override
            public boolean approve(AccountId spender, BigInteger amount) {
                return plain.approve(spender, amount);
            }

            @Override
            public BigInteger balanceOf(AccountId account) {
                return plain.balanceOf(account);
            }
        };
        FixedRateStrategy victim = newStrategy(hostile, venue.connect(STRATEGY));
        target.set(victim);
        victim.setHarvestDelay(OWNER, HARVEST_DELAY);
        victim.initialize(OWNER);
        fund(ALICE, 100);

        assertThatThrownBy(() -> victim.deposit(ALICE, n(100)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(StrategyException.REENTRANT_CALL));

        assertThat(sharesSeenInCallback.get()).isZero();
        assertThat(victim.totalShares()).isZero();
        assertThat(token.balanceOf(ALICE)).isEqualTo(n(100));
    }

    @Test
    @DisplayName("events are published after the call commits, with caller and values")
    void events_publishedOnSuccessOnly() {
        fund(ALICE, 100);
        strategy.deposit(ALICE, n(100));
        assertThatThrownBy(() -> strategy.withdraw(ALICE, n(100))).isInstanceOf(StrategyException.class);
        clock.advanceSeconds(HARVEST_DELAY);
        strategy.setHarvestDelay(OWNER, 7200);
        strategy.harvest(KEEPER);

        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        List<ApplicationEvent> published = captor.getAllValues();

        DepositEvent deposit = published.stream().filter(DepositEvent.class::isInstance)
                .map(DepositEvent.class::cast).findFirst().orElseThrow();
        assertThat(deposit.getCaller()).isEqualTo(ALICE);
        assertThat(deposit.getStrategy()).isEqualTo(STRATEGY);
        assertThat(deposit.getValues()).containsEntry("amount", "100").containsEntry("shares", "100");

        assertThat(published).noneMatch(WithdrawalEvent.class::isInstance);
        assertThat(published).anyMatch(HarvestDelayUpdateScheduledEvent.class::isInstance);
        assertThat(published).anyMatch(HarvestEvent.class::isInstance);
        assertThat(published.stream().filter(HarvestDelayUpdatedEvent.class::isInstance)
                .map(e -> ((StrategyEvent) e).getValues().get("harvestDelaySeconds")))
                .contains("3600", "7200");
    }

    @Test
    @DisplayName("share supply equals the sum of balances after every operation, failed ones included")
    void conservation_underRandomOperations() {
        strategy.setFixedRate(OWNER, n(10_000_000_000L));
        List<AccountId> accounts = List.of(ALICE, BOB, AccountId.of("0x3333333333333333333333333333333333333333"));
        accounts.forEach(a -> fund(a, 1_000_000));
        Random random = new Random(42);

        for (int i = 0; i < 400; i++) {
            AccountId who = accounts.get(random.nextInt(accounts.size()));
            try {
                switch (random.nextInt(5)) {
                    case 0, 1 -> strategy.deposit(who, n(1 + random.nextInt(5_000)));
                    case 2 -> strategy.withdraw(who, n(1 + random.nextInt(5_000)));
                    case 3 -> venue.accrueYield(n(random.nextInt(200)));
                    default -> strategy.harvest(KEEPER);
                }
            } catch (RuntimeException refused) {
                // refused operations must leave the books balanced too
            }
            clock.advanceSeconds(random.nextInt(900));

            Map<AccountId, BigInteger> balances = strategy.shareBalances();
            BigInteger sum = balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
            assertThat(sum).isEqualTo(strategy.totalShares());
            BigInteger claims = balances.keySet().stream()
                    .map(strategy::balanceOfUnderlying)
                    .reduce(BigInteger.ZERO, BigInteger::add);
            assertThat(claims).isLessThanOrEqualTo(strategy.totalHoldings());
        }
    }

    private FixedRateStrategy gatedStrategy(AssetToken asset, YieldVenue yieldVenue) {
        FixedRateStrategy gated = newStrategy(asset, yieldVenue);
        gated.setHarvestDelay(OWNER, HARVEST_DELAY);
        gated.setWithdrawalDelay(OWNER, WITHDRAWAL_DELAY);
        gated.initialize(OWNER);
        return gated;
    }

    /** Asset handle that refuses payouts to one recipient. */
    private static final class GatedToken implements AssetToken {
        private final AssetToken delegate;
        AccountId refusedRecipient;

        GatedToken(AssetToken delegate) {
            this.delegate = delegate;
        }

        @Override
        public AccountId id() {
            return delegate.id();
        }

        @Override
        public boolean transferFrom(AccountId from, AccountId to, BigInteger amount) {
            return delegate.transferFrom(from, to, amount);
        }

        @Override
        public boolean transfer(AccountId to, BigInteger amount) {
            return !to.equals(refusedRecipient) && delegate.transfer(to, amount);
        }

        @Override
        public boolean approve(AccountId spender, BigInteger amount) {
            return delegate.approve(spender, amount);
        }

        @Override
        public BigInteger balanceOf(AccountId account) {
            return delegate.balanceOf(account);
        }
    }

    /** Venue handle whose deposits or withdrawals can be paused. */
    private static final class GatedVenue implements YieldVenue {
        private final YieldVenue delegate;
        boolean depositsPaused;
        boolean withdrawalsPaused;

        GatedVenue(YieldVenue delegate) {
            this.delegate = delegate;
        }

        @Override
        public AccountId id() {
            return delegate.id();
        }

        @Override
        public void deposit(BigInteger amount) {
            if (depositsPaused) {
                throw new VenueException("deposits paused");
            }
            delegate.deposit(amount);
        }

        @Override
        public void withdraw(BigInteger shareAmount) {
            if (withdrawalsPaused) {
                throw new VenueException("withdrawals paused");
            }
            delegate.withdraw(shareAmount);
        }

        @Override
        public BigInteger balance() {
            return delegate.balance();
        }

        @Override
        public BigInteger totalSupply() {
            return delegate.totalSupply();
        }

        @Override
        public BigInteger pricePerShare() {
            return delegate.pricePerShare();
        }

        @Override
        public BigInteger venueShareBalanceOf(AccountId owner) {
            return delegate.venueShareBalanceOf(owner);
        }
    }
}
