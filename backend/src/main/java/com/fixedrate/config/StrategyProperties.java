package com.fixedrate.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine identity, authority and initial parameters. Applied by {@link StrategyBootstrap} on startup.
 */
@ConfigurationProperties(prefix = "fixedrate.strategy")
@NoArgsConstructor
@Getter
@Setter
public class StrategyProperties {

    /** Engine address; also the protocol-fee account. */
    private String address = "0x00000000000000000000000000000000000f1ed0";

    /** Address allowed to call every privileged operation. */
    private String owner = "0x000000000000000000000000000000000000a11c";

    /** Addresses allowed to harvest in addition to the owner. */
    private List<String> keepers = new ArrayList<>();

    /** Seconds a depositor waits after their latest deposit before withdrawing. */
    private long withdrawalDelaySeconds = 86_400;

    /** Seconds between harvests. Must be in (0, 365 days]. */
    private long harvestDelaySeconds = 21_600;

    /** Target growth per second, WAD-scaled. Default ~5% per year (0.05e18 / 31_536_000). */
    private String fixedRatePerSecond = "1585489599";

    /** Initialize the engine once parameters are applied. */
    private boolean autoInitialize = true;
}
