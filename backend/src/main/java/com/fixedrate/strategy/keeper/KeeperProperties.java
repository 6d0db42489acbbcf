package com.fixedrate.strategy.keeper;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Automatic harvest keeper. The keeper address must be allowed to harvest by the access policy.
 */
@ConfigurationProperties(prefix = "fixedrate.keeper")
@NoArgsConstructor
@Getter
@Setter
public class KeeperProperties {

    /** Run the scheduled harvest job. */
    private boolean enabled = false;

    /** Address the keeper harvests as. */
    private String address;

    /** How often (ms) to check whether a harvest is due. */
    private long pollIntervalMs = 60_000;
}
