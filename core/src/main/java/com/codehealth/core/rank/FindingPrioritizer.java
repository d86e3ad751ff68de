package com.codehealth.core.rank;

import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.util.PenaltyWeights;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 우선순위 전순서 + 표시 ID(F001, F002, ...) 부여.
 * tier ↓ → severity ↓ → confidence ↓ → penalty ↓ → file ↑ → line ↑(없으면 맨 뒤)
 *
 * ID는 위치 기반이라 같은 입력 집합에서만 안정적이다.
 */
public final class FindingPrioritizer {
    private FindingPrioritizer() {}

    public static final Comparator<MergedFinding> PRIORITY =
            Comparator.<MergedFinding>comparingInt(m -> PenaltyWeights.tierWeight(m.getTier())).reversed()
                    .thenComparing(Comparator.<MergedFinding>comparingInt(m -> m.getSeverity().rank()).reversed())
                    .thenComparing(Comparator.<MergedFinding>comparingInt(m -> m.getConfidence().rank()).reversed())
                    .thenComparing(Comparator.<MergedFinding>comparingDouble(PenaltyWeights::penalty).reversed())
                    .thenComparing(MergedFinding::getFile)
                    .thenComparing(MergedFinding::getLine, Comparator.nullsLast(Comparator.naturalOrder()));

    /** 정렬 후 ID 부여한 새 목록. 입력은 건드리지 않는다 */
    public static List<MergedFinding> rank(Collection<MergedFinding> merged) {
        List<MergedFinding> sorted = new ArrayList<>(merged);
        sorted.sort(PRIORITY);

        List<MergedFinding> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            out.add(sorted.get(i).toBuilder().id(displayId(i + 1)).build());
        }
        return out;
    }

    /** 1 → "F001", 1000 → "F1000" */
    public static String displayId(int position) {
        return String.format("F%03d", position);
    }
}
