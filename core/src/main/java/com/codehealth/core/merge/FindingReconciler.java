package com.codehealth.core.merge;

import com.codehealth.core.merge.dedupe.Fingerprint;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.model.Ranked;
import com.codehealth.core.model.Status;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 필드 단위 병합 규칙 (순수 함수).
 *  - tier/severity/confidence: 강한 값 유지, 다르면 충돌 기록
 *  - line: 가장 작은 양수
 *  - summary: 긴 쪽 (충돌 아님)
 *  - evidence: " || "로 이어붙이되 완전 중복 제거, 최초 등장 순서
 *  - recommended_fix: 비어있지 않고 다르면 충돌 + 긴 쪽
 *  - status: 다르면 충돌, 어느 한쪽이라도 open이면 open
 *  - 충돌이 하나라도 있으면 needs_validation=true, conflict_note 누적
 */
public final class FindingReconciler {
    private FindingReconciler() {}

    public static final String EVIDENCE_SEP = " || ";
    public static final String NOTE_SEP = "; ";

    /** 첫 등장 레코드로 병합 레코드 시작 */
    public static MergedFinding seed(Finding f) {
        return MergedFinding.builder()
                .fingerprint(Fingerprint.of(f).key())
                .detector(f.getDetector())
                .tier(f.getTier())
                .severity(f.getSeverity())
                .confidence(f.getConfidence())
                .file(f.getFile())
                .line(f.getLine())
                .summary(f.getSummary())
                .evidence(f.getEvidence())
                .recommendedFix(f.getRecommendedFix())
                .status(f.getStatus())
                .conflictNote(f.getConflictNote())
                .needsValidation(f.isNeedsValidation())
                .addSource(f.getSource())
                .build();
    }

    /** existing에 candidate를 접은 새 레코드. 입력은 변경하지 않는다. */
    public static MergedFinding reconcile(MergedFinding existing, Finding candidate) {
        List<String> conflicts = new ArrayList<>();
        MergedFinding.Builder b = existing.toBuilder();

        // 1) 순위 필드
        b.tier(strongest("tier", existing.getTier(), candidate.getTier(), conflicts));
        b.severity(strongest("severity", existing.getSeverity(), candidate.getSeverity(), conflicts));
        b.confidence(strongest("confidence", existing.getConfidence(), candidate.getConfidence(), conflicts));

        // 2) 위치
        b.line(earliestLine(existing.getLine(), candidate.getLine()));

        // 3) 텍스트
        if (candidate.getSummary().length() > existing.getSummary().length()) {
            b.summary(candidate.getSummary());
        }
        b.evidence(mergeEvidence(existing.getEvidence(), candidate.getEvidence()));

        String newFix = candidate.getRecommendedFix();
        String oldFix = existing.getRecommendedFix();
        if (!newFix.isEmpty() && !newFix.equals(oldFix)) {
            conflicts.add("recommended_fix differs");
            if (newFix.length() > oldFix.length()) b.recommendedFix(newFix);
        }

        // 4) 상태: 한 소스가 fixed라 해도 다른 소스가 open이면 open 유지
        Status oldStatus = existing.getStatus();
        Status newStatus = candidate.getStatus();
        if (newStatus != oldStatus) {
            conflicts.add("status: " + oldStatus.wire() + " vs " + newStatus.wire());
            b.status(oldStatus == Status.OPEN || newStatus == Status.OPEN ? Status.OPEN : oldStatus);
        }

        // 5) 검증 플래그 / 충돌 노트
        boolean needsValidation = existing.isNeedsValidation() || candidate.isNeedsValidation();
        if (!conflicts.isEmpty()) {
            needsValidation = true;
            b.conflictNote(appendNote(existing.getConflictNote(), conflicts));
        }
        b.needsValidation(needsValidation);

        b.addSource(candidate.getSource());
        return b.build();
    }

    // ---------- helpers ----------

    private static <E extends Ranked> E strongest(String field, E current, E incoming, List<String> conflicts) {
        if (incoming != current) {
            conflicts.add(field + ": " + current.wire() + " vs " + incoming.wire());
        }
        return Ranked.stronger(current, incoming);
    }

    static Integer earliestLine(Integer current, Integer incoming) {
        if (incoming == null || incoming < 1) return current;
        if (current == null || incoming < current) return incoming;
        return current;
    }

    static String mergeEvidence(String old, String add) {
        Set<String> parts = new LinkedHashSet<>();
        for (String blob : new String[] { old, add }) {
            if (blob == null) continue;
            for (String p : blob.split(" \\|\\| ", -1)) {
                String t = p.trim();
                if (!t.isEmpty()) parts.add(t);
            }
        }
        return String.join(EVIDENCE_SEP, parts);
    }

    /** 기존 노트 원문은 그대로 두고, 이번 접기의 충돌(정렬·중복 제거) 중 노트에 없는 것만 덧붙인다 */
    static String appendNote(String note, List<String> conflicts) {
        String base = (note == null) ? "" : note;
        Set<String> present = new HashSet<>(Arrays.asList(base.split(Pattern.quote(NOTE_SEP))));
        StringBuilder sb = new StringBuilder(base);
        for (String c : new TreeSet<>(conflicts)) {
            if (!present.add(c)) continue;
            if (sb.length() > 0) sb.append(NOTE_SEP);
            sb.append(c);
        }
        return sb.toString();
    }
}
