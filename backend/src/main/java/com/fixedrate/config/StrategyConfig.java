package com.fixedrate.config;

import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.access.AccessPolicy;
import com.fixedrate.strategy.access.OwnerAccessPolicy;
import com.fixedrate.strategy.engine.FixedRateStrategy;
import com.fixedrate.strategy.keeper.KeeperProperties;
import com.fixedrate.venue.simulation.SimulatedToken;
import com.fixedrate.venue.simulation.SimulatedYieldVenue;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires one strategy instance against the simulated asset and venue.
 */
@Configuration
@EnableConfigurationProperties({StrategyProperties.class, SimulationProperties.class, KeeperProperties.class})
public class StrategyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SimulatedToken simulatedToken(SimulationProperties simulationProperties) {
        return new SimulatedToken(AccountId.of(simulationProperties.getAssetAddress()));
    }

    @Bean
    public SimulatedYieldVenue simulatedYieldVenue(SimulationProperties simulationProperties, SimulatedToken token) {
        return new SimulatedYieldVenue(AccountId.of(simulationProperties.getVenueAddress()), token);
    }

    @Bean
    public AccessPolicy accessPolicy(StrategyProperties strategyProperties) {
        Set<AccountId> keepers = strategyProperties.getKeepers().stream()
                .map(AccountId::of)
                .collect(Collectors.toSet());
        return new OwnerAccessPolicy(AccountId.of(strategyProperties.getOwner()), keepers);
    }

    @Bean
    public FixedRateStrategy fixedRateStrategy(StrategyProperties strategyProperties, SimulatedToken token,
                                               SimulatedYieldVenue venue, AccessPolicy accessPolicy,
                                               ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        AccountId address = AccountId.of(strategyProperties.getAddress());
        return new FixedRateStrategy(address, token.connect(address), venue.connect(address), accessPolicy,
                applicationEventPublisher, clock);
    }
}
