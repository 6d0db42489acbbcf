package com.fixedrate.api.controller;

import com.fixedrate.api.dto.AmountRequest;
import com.fixedrate.api.dto.ConversionResponse;
import com.fixedrate.api.dto.DelayRequest;
import com.fixedrate.api.dto.DepositResponse;
import com.fixedrate.api.dto.FixedRateRequest;
import com.fixedrate.api.dto.PayoutResponse;
import com.fixedrate.api.dto.StrategyEventResponse;
import com.fixedrate.api.validation.CallerResolver;
import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.engine.AccountPosition;
import com.fixedrate.strategy.engine.FixedRateStrategy;
import com.fixedrate.strategy.engine.HarvestReport;
import com.fixedrate.strategy.engine.StrategySnapshot;
import com.fixedrate.strategy.index.StrategyEventQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * Strategy views and entry points. The caller identity comes from the X-Caller header; authorization is the
 * engine's access policy, not this layer.
 */
@RestController
@RequestMapping("/api/v1/strategy")
@RequiredArgsConstructor
public class StrategyController {

    private final FixedRateStrategy fixedRateStrategy;
    private final StrategyEventQueryService strategyEventQueryService;
    private final CallerResolver callerResolver;

    @GetMapping
    public ResponseEntity<StrategySnapshot> snapshot() {
        return ResponseEntity.ok(fixedRateStrategy.snapshot());
    }

    @GetMapping("/accounts/{address}")
    public ResponseEntity<AccountPosition> account(@PathVariable String address) {
        return ResponseEntity.ok(fixedRateStrategy.accountPosition(callerResolver.resolveAccount(address)));
    }

    @GetMapping("/convert/to-shares")
    public ResponseEntity<ConversionResponse> toShares(@RequestParam BigInteger amount) {
        return ResponseEntity.ok(new ConversionResponse(amount, fixedRateStrategy.convertToShares(amount)));
    }

    @GetMapping("/convert/to-underlying")
    public ResponseEntity<ConversionResponse> toUnderlying(@RequestParam BigInteger shares) {
        return ResponseEntity.ok(new ConversionResponse(shares, fixedRateStrategy.convertToUnderlying(shares)));
    }

    @PostMapping("/deposit")
    public ResponseEntity<DepositResponse> deposit(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller,
            @RequestBody @Valid AmountRequest request) {
        BigInteger shares = fixedRateStrategy.deposit(callerResolver.resolve(caller), request.amount());
        return ResponseEntity.ok(new DepositResponse(request.amount(), shares));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<PayoutResponse> withdraw(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller,
            @RequestBody @Valid AmountRequest request) {
        BigInteger received = fixedRateStrategy.withdraw(callerResolver.resolve(caller), request.amount());
        return ResponseEntity.ok(new PayoutResponse(request.amount(), received));
    }

    @PostMapping("/harvest")
    public ResponseEntity<HarvestReport> harvest(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller) {
        return ResponseEntity.ok(fixedRateStrategy.harvest(callerResolver.resolve(caller)));
    }

    @PostMapping("/claim-profit")
    public ResponseEntity<PayoutResponse> claimProfit(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller) {
        AccountId claimant = callerResolver.resolve(caller);
        BigInteger claimable = fixedRateStrategy.balanceOfUnderlying(fixedRateStrategy.getAddress());
        BigInteger received = fixedRateStrategy.claimProfit(claimant);
        return ResponseEntity.ok(new PayoutResponse(claimable, received));
    }

    @PostMapping("/initialize")
    public ResponseEntity<StrategySnapshot> initialize(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller) {
        fixedRateStrategy.initialize(callerResolver.resolve(caller));
        return ResponseEntity.ok(fixedRateStrategy.snapshot());
    }

    @PutMapping("/settings/withdrawal-delay")
    public ResponseEntity<StrategySnapshot> setWithdrawalDelay(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller,
            @RequestBody @Valid DelayRequest request) {
        fixedRateStrategy.setWithdrawalDelay(callerResolver.resolve(caller), request.seconds());
        return ResponseEntity.ok(fixedRateStrategy.snapshot());
    }

    @PutMapping("/settings/harvest-delay")
    public ResponseEntity<StrategySnapshot> setHarvestDelay(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller,
            @RequestBody @Valid DelayRequest request) {
        fixedRateStrategy.setHarvestDelay(callerResolver.resolve(caller), request.seconds());
        return ResponseEntity.ok(fixedRateStrategy.snapshot());
    }

    @PutMapping("/settings/fixed-rate")
    public ResponseEntity<StrategySnapshot> setFixedRate(
            @RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String caller,
            @RequestBody @Valid FixedRateRequest request) {
        fixedRateStrategy.setFixedRate(callerResolver.resolve(caller), request.ratePerSecond());
        return ResponseEntity.ok(fixedRateStrategy.snapshot());
    }

    @GetMapping("/events")
    public ResponseEntity<List<StrategyEventResponse>> events(
            @RequestParam(required = false) String caller,
            @RequestParam(required = false) Integer limit) {
        AccountId filter = caller != null && !caller.isBlank() ? callerResolver.resolveAccount(caller) : null;
        return ResponseEntity.ok(strategyEventQueryService.recent(fixedRateStrategy.getAddress(), filter, limit).stream()
                .map(r -> new StrategyEventResponse(
                        r.getId(),
                        r.getType() != null ? r.getType().name() : null,
                        r.getCaller(),
                        r.getValues(),
                        r.getOccurredAt()))
                .toList());
    }
}
