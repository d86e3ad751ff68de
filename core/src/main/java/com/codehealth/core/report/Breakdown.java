package com.codehealth.core.report;

import com.codehealth.core.model.Detector;
import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.model.Tier;
import com.codehealth.core.util.PenaltyWeights;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * tier별 / detector별 건수와 감점 합.
 * detectorsWithZeroFindings 는 "건강함"이 아니라 "커버리지 부족" 신호다.
 */
public record Breakdown(@JsonProperty("by_tier") Map<String, Bucket> byTier,
                        @JsonProperty("by_detector") Map<String, Bucket> byDetector,
                        @JsonProperty("detectors_with_zero_findings") List<String> detectorsWithZeroFindings) {

    public record Bucket(@JsonProperty("count") int count,
                         @JsonProperty("penalty") double penalty) {}

    public static Breakdown of(Collection<MergedFinding> findings) {
        Map<String, Bucket> byTier = new LinkedHashMap<>();
        for (Tier t : Tier.values()) {
            byTier.put(t.wire(), bucket(findings.stream().filter(m -> m.getTier() == t).toList()));
        }

        Map<String, Bucket> byDetector = new LinkedHashMap<>();
        List<String> zero = new ArrayList<>();
        for (Detector d : Detector.values()) {
            Bucket b = bucket(findings.stream().filter(m -> m.getDetector() == d).toList());
            byDetector.put(d.wire(), b);
            if (b.count() == 0) zero.add(d.wire());
        }
        return new Breakdown(byTier, byDetector, List.copyOf(zero));
    }

    private static Bucket bucket(List<MergedFinding> items) {
        double sum = 0;
        for (MergedFinding m : items) sum += PenaltyWeights.penalty(m);
        return new Bucket(items.size(), PenaltyWeights.round2(sum));
    }
}
