package com.fixedrate.api.controller;

import com.fixedrate.api.dto.FaucetRequest;
import com.fixedrate.api.dto.SimulationBalanceResponse;
import com.fixedrate.api.dto.VenueAdjustmentRequest;
import com.fixedrate.api.validation.CallerResolver;
import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.engine.FixedRateStrategy;
import com.fixedrate.venue.simulation.SimulatedToken;
import com.fixedrate.venue.simulation.SimulatedYieldVenue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Drives the simulated asset and venue: fund accounts, move the venue's value up or down.
 */
@RestController
@RequestMapping("/api/v1/simulation")
@ConditionalOnProperty(prefix = "fixedrate.simulation", name = "endpoints-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final SimulatedToken simulatedToken;
    private final SimulatedYieldVenue simulatedYieldVenue;
    private final FixedRateStrategy fixedRateStrategy;
    private final CallerResolver callerResolver;

    /** Mints asset to the account and gives the strategy an unlimited allowance on it. */
    @PostMapping("/faucet")
    public ResponseEntity<SimulationBalanceResponse> faucet(@RequestBody @Valid FaucetRequest request) {
        AccountId account = AccountId.of(request.account());
        simulatedToken.mint(account, request.amount());
        simulatedToken.approve(account, fixedRateStrategy.getAddress(), FixedPointMath.MAX_UINT256);
        log.info("Faucet: {} minted to {}", request.amount(), account);
        return ResponseEntity.ok(balance(account));
    }

    @PostMapping("/venue/accrue")
    public ResponseEntity<SimulationBalanceResponse> accrue(@RequestBody @Valid VenueAdjustmentRequest request) {
        simulatedYieldVenue.accrueYield(request.amount());
        return ResponseEntity.ok(balance(fixedRateStrategy.getAddress()));
    }

    @PostMapping("/venue/loss")
    public ResponseEntity<SimulationBalanceResponse> loss(@RequestBody @Valid VenueAdjustmentRequest request) {
        simulatedYieldVenue.realizeLoss(request.amount());
        return ResponseEntity.ok(balance(fixedRateStrategy.getAddress()));
    }

    @GetMapping("/balances/{address}")
    public ResponseEntity<SimulationBalanceResponse> balances(@PathVariable String address) {
        return ResponseEntity.ok(balance(callerResolver.resolveAccount(address)));
    }

    private SimulationBalanceResponse balance(AccountId account) {
        return new SimulationBalanceResponse(
                account.value(),
                simulatedToken.balanceOf(account),
                simulatedYieldVenue.balance(),
                simulatedYieldVenue.pricePerShare());
    }
}
