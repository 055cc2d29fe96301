package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One login or registration attempt, kept for fraud analysis and auditing")
public class LoginAttempt {

    public static final String UNKNOWN_FINGERPRINT = "unknown";

    @Schema(description = "Attempt identifier", example = "4f6c1d2e-8a9b-4c3d-9e1f-0a1b2c3d4e5f")
    private String attemptId;

    @Schema(description = "Normalized phone number", example = "919876543210")
    private String phone;

    @Schema(description = "Source IP address", example = "203.0.113.7")
    private String ip;

    @Schema(description = "Client device fingerprint", example = "fp-7c1e9a")
    private String fingerprint;

    @Schema(description = "Client user-agent", example = "Mozilla/5.0 (Linux; Android 14)")
    private String userAgent;

    @Schema(description = "Whether the attempt authenticated", example = "false")
    private boolean success;

    @Schema(description = "Outcome reason code", example = "wrong_mpin")
    private AttemptReason reason;

    @Schema(description = "Risk score assigned to the attempt (0-100)", example = "25")
    private int riskScore;

    @Schema(description = "Attempt timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;
}
