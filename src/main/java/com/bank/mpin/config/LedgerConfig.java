package com.bank.mpin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "auth.ledger")
public class LedgerConfig {

    private int retentionDays = 90;
    private int purgeIntervalMinutes = 60;

    public long getRetentionMillis() {
        return retentionDays * 24L * 60 * 60 * 1000;
    }

    public int getRetentionSeconds() {
        return retentionDays * 24 * 60 * 60;
    }
}
