package com.codehealth.core.report;

import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.score.HealthScorer.ScoreSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** 병합 보고서 루트. JSON 키는 snake_case, 직렬화 시 알파벳 정렬 */
public record Report(@JsonProperty("total_findings") int totalFindings,
                     @JsonProperty("findings") List<MergedFinding> findings,
                     @JsonProperty("scores") ScoreSummary scores,
                     @JsonProperty("breakdown") Breakdown breakdown,
                     @JsonProperty("next") List<String> next,
                     @JsonProperty("plan") RemediationPlan plan,
                     @JsonProperty("resolve_simulation") List<ResolveSuggestion> resolveSimulation) {
}
