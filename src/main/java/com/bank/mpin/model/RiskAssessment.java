package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Risk verdict for a login attempt")
public class RiskAssessment {

    @Schema(description = "Additive risk score clamped to 0-100. ALLOW <= 30, WARN 31-60, BLOCK > 60", example = "25")
    private int score;

    @Schema(description = "Flags raised by the risk rules", example = "[\"new_device\"]")
    @Builder.Default
    private Set<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);

    @Schema(description = "Recommended action", example = "ALLOW")
    private RiskAction action;

    @Schema(description = "Per-rule breakdown")
    @Builder.Default
    private List<RuleResult> ruleResults = new ArrayList<>();

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;

    public static RiskAssessment fallback(int score, long now) {
        return RiskAssessment.builder()
                .score(score)
                .flags(EnumSet.of(RiskFlag.DETECTION_ERROR))
                .action(RiskAction.ALLOW)
                .evaluatedAt(now)
                .build();
    }
}
