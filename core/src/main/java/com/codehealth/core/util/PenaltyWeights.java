package com.codehealth.core.util;

import com.codehealth.core.model.Confidence;
import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.model.Severity;
import com.codehealth.core.model.Tier;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 감점 가중치 표 (고정).
 * penalty = tierWeight × severityMultiplier × confidenceMultiplier
 *  - T1/high/high = 20.0 (최대), T4/low/low = 0.15 (최소)
 */
public final class PenaltyWeights {
    private PenaltyWeights() {}

    public static int tierWeight(Tier t) {
        return switch (t) {
            case T1 -> 20;
            case T2 -> 10;
            case T3 -> 4;
            case T4 -> 1;
        };
    }

    public static double severityMultiplier(Severity s) {
        return switch (s) {
            case HIGH -> 1.0;
            case MED  -> 0.6;
            case LOW  -> 0.3;
        };
    }

    public static double confidenceMultiplier(Confidence c) {
        return switch (c) {
            case HIGH -> 1.0;
            case MED  -> 0.75;
            case LOW  -> 0.5;
        };
    }

    public static double penalty(Tier t, Severity s, Confidence c) {
        return tierWeight(t) * severityMultiplier(s) * confidenceMultiplier(c);
    }

    public static double penalty(MergedFinding m) {
        return penalty(m.getTier(), m.getSeverity(), m.getConfidence());
    }

    /** 보고서 표기용 소수 둘째 자리. double의 정확한 이진값 기준 HALF_EVEN (79.625 → 79.62) */
    public static double round2(double v) {
        return new BigDecimal(v).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
