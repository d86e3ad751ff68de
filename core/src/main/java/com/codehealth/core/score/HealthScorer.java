package com.codehealth.core.score;

import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.model.Status;
import com.codehealth.core.util.PenaltyWeights;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * 건강 점수 (0..100, 소수 둘째 자리).
 *  - strict  = 100 − Σ penalty(전체)                       : 상태 무시, 비관적 상한선
 *  - overall = 100 − (Σ penalty(open) + 0.5 × Σ penalty(wontfix))
 * fixed / false_positive 는 overall에서 감점하지 않는다.
 */
public final class HealthScorer {
    private HealthScorer() {}

    public static final double WONTFIX_FACTOR = 0.5;

    public static ScoreSummary score(Collection<MergedFinding> findings) {
        if (findings == null || findings.isEmpty()) return new ScoreSummary(100.0, 100.0);

        double strictPenalty = 0, openPenalty = 0, wontfixPenalty = 0;
        for (MergedFinding m : findings) {
            double p = PenaltyWeights.penalty(m);
            strictPenalty += p;
            if (m.getStatus() == Status.OPEN) openPenalty += p;
            else if (m.getStatus() == Status.WONTFIX) wontfixPenalty += p;
        }

        double strict  = clamp(100.0 - strictPenalty);
        double overall = clamp(100.0 - (openPenalty + WONTFIX_FACTOR * wontfixPenalty));
        return new ScoreSummary(PenaltyWeights.round2(overall), PenaltyWeights.round2(strict));
    }

    private static double clamp(double v) {
        return Math.min(100.0, Math.max(0.0, v));
    }

    public record ScoreSummary(@JsonProperty("overall_score") double overallScore,
                               @JsonProperty("strict_score") double strictScore) {}
}
