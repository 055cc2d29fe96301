package com.bank.mpin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "auth.risk")
public class RiskThresholdConfig {

    // Scores at or below this are allowed silently
    private int warnThreshold = 30;

    // Scores above this are blocked and need OTP re-verification
    private int blockThreshold = 60;

    private int historyWindowDays = 30;
    private int historyLimit = 50;

    private int rapidWindowMinutes = 5;
    private int rapidAttemptThreshold = 3;

    // Inclusive hour-of-day range treated as unusual
    private int unusualHourStart = 2;
    private int unusualHourEnd = 5;
    private String zoneId = "UTC";

    // Score returned when the attempt history cannot be read
    private int fallbackScore = 10;

    private Points points = new Points();

    @Data
    public static class Points {
        private int firstLogin = 5;
        private int newIp = 20;
        private int newDevice = 25;
        private int rapidAttempts = 30;
        private int highFailureRate = 15;
        private int unusualHour = 10;
    }

    public long getHistoryWindowMillis() {
        return historyWindowDays * 24L * 60 * 60 * 1000;
    }

    public long getRapidWindowMillis() {
        return rapidWindowMinutes * 60_000L;
    }
}
