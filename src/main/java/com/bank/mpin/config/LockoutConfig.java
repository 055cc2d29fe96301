package com.bank.mpin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "auth.lockout")
public class LockoutConfig {

    // Consecutive wrong MPINs that lock the account
    private int maxFailures = 5;

    private int lockDurationMinutes = 30;

    // Attempts at a compare-and-swap before the request gives up
    private int maxUpdateRetries = 16;

    public long getLockDurationMillis() {
        return lockDurationMinutes * 60_000L;
    }
}
