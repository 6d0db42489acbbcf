package com.fixedrate.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * In-process asset and venue the engine runs against.
 */
@ConfigurationProperties(prefix = "fixedrate.simulation")
@NoArgsConstructor
@Getter
@Setter
public class SimulationProperties {

    private String assetAddress = "0x000000000000000000000000000000000000a55e";

    private String venueAddress = "0x0000000000000000000000000000000000007e1e";

    /** Expose faucet and venue yield/loss endpoints. */
    private boolean endpointsEnabled = true;
}
