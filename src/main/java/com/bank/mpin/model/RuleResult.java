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
@Schema(description = "Evaluation result from a single login risk rule")
public class RuleResult {

    @Schema(description = "Flag raised by the rule", example = "new_ip")
    private RiskFlag flag;

    @Schema(description = "Whether the rule fired", example = "true")
    private boolean triggered;

    @Schema(description = "Points added to the risk score", example = "20")
    private int points;

    @Schema(description = "Human-readable explanation", example = "IP 203.0.113.7 not among 2 known IPs")
    private String reason;
}
