package com.bank.mpin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Verdict of a register or login request. Exactly one outcome; the remaining
 * fields are populated only where that outcome defines them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a register or login request")
public class AuthResult {

    @Schema(description = "Outcome of the request", example = "SUCCESS")
    private AuthOutcome outcome;

    @Schema(description = "User-facing message", example = "Login successful! Welcome back.")
    private String message;

    @Schema(description = "Session token, present on success")
    private String token;

    @Schema(description = "Session expiry in epoch milliseconds, present on success")
    private Long expiresAt;

    @Schema(description = "Authenticated user, present on success")
    private UserView user;

    @Schema(description = "Lock expiry in epoch milliseconds, present when the account is locked")
    private Long lockedUntil;

    @Schema(description = "Wrong MPIN entries left before the account locks", example = "3")
    private Integer attemptsRemaining;

    @Schema(description = "Risk score of the login attempt", example = "25")
    private Integer riskScore;

    @Schema(description = "Risk flags raised for the login attempt")
    private Set<RiskFlag> riskFlags;

    @Schema(description = "Risk action for the login attempt", example = "ALLOW")
    private RiskAction riskAction;

    @Schema(description = "Set when the caller must re-verify the phone out of band before retrying", example = "true")
    private Boolean requireOtpReverification;

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }

    public static AuthResult of(AuthOutcome outcome, String message) {
        return AuthResult.builder().outcome(outcome).message(message).build();
    }
}
