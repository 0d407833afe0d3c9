package com.nifty.bulk.client.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "client.sync")
public class SyncProperties {
    private Duration sessionCheckInterval = Duration.ofSeconds(60); // fencing check + refresh
    private Duration reconcileInterval = Duration.ofSeconds(5);     // authoritative ledger pull
    private Duration refreshThreshold = Duration.ofMinutes(5);      // refresh when expiry is closer than this
    private boolean resumeOnStartup = true;
}
