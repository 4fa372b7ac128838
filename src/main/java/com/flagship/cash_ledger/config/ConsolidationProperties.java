package com.flagship.cash_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Consolidation run settings bound from {@code consolidation.*}.
 */
@ConfigurationProperties(prefix = "consolidation")
@Getter
@Setter
public class ConsolidationProperties {

    /**
     * How far behind the run start the watermark is left. Must exceed the
     * longest ingestion transaction, since identities are stamped before commit.
     */
    private Duration watermarkLag = Duration.ofMinutes(5);

    /** Lifetime of a tenant lease; a crashed holder blocks the tenant at most this long. */
    private Duration leaseDuration = Duration.ofMinutes(15);

    /** How long an on-demand run waits for another holder before giving up. */
    private Duration leaseWait = Duration.ofSeconds(30);
}
