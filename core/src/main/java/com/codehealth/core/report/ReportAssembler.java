package com.codehealth.core.report;

import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.score.HealthScorer;

import java.util.List;
import java.util.Objects;

/** 정렬·ID 부여가 끝난 병합 집합 → Report (읽기 전용) */
public final class ReportAssembler {

    private final AuditConfig cfg;

    public ReportAssembler(AuditConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /** @param ranked FindingPrioritizer.rank() 결과 (우선순위 순) */
    public Report assemble(List<MergedFinding> ranked) {
        List<MergedFinding> top = topOpen(ranked, cfg.getNextLimit());
        return new Report(
                ranked.size(),
                List.copyOf(ranked),
                HealthScorer.score(ranked),
                Breakdown.of(ranked),
                top.stream().map(MergedFinding::getId).toList(),
                RemediationPlan.of(top, cfg),
                top.stream().map(ResolveSuggestion::forFinding).toList());
    }

    /** 우선순위 상위 open 레코드 최대 limit 개 */
    public static List<MergedFinding> topOpen(List<MergedFinding> ranked, int limit) {
        return ranked.stream()
                .filter(MergedFinding::isOpen)
                .limit(Math.max(0, limit))
                .toList();
    }
}
