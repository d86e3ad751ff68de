package com.codehealth.core.report;

import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.model.MergedFinding;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** 상위 open 레코드를 quick win(약한 tier 또는 외형성 detector) / 구조 리팩터로 나눈다 */
public record RemediationPlan(@JsonProperty("quick_wins") List<String> quickWins,
                              @JsonProperty("refactors") List<String> refactors) {

    public static RemediationPlan of(Collection<MergedFinding> top, AuditConfig cfg) {
        List<String> quick = new ArrayList<>();
        List<String> refactor = new ArrayList<>();
        for (MergedFinding m : top) {
            String item = m.getId() + ": " + m.getSummary();
            if (isQuickWin(m, cfg)) quick.add(item);
            else refactor.add(item);
        }
        return new RemediationPlan(List.copyOf(quick), List.copyOf(refactor));
    }

    static boolean isQuickWin(MergedFinding m, AuditConfig cfg) {
        return cfg.getQuickWinTiers().contains(m.getTier())
                || cfg.getCosmeticDetectors().contains(m.getDetector());
    }
}
