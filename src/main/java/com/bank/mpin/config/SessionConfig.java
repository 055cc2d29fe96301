package com.bank.mpin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "auth.session")
public class SessionConfig {

    // HMAC key for session tokens, at least 32 bytes
    private String secret;

    private int ttlMinutes = 15;
    private String issuer = "SmartBank";
    private String audience = "smartbank-app";
    private String cookieName = "smartbank_token";
    private boolean secureCookie = true;

    public long getTtlMillis() {
        return ttlMinutes * 60_000L;
    }
}
