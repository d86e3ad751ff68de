package com.codehealth.core.merge;

import com.codehealth.core.merge.dedupe.Fingerprint;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.MergedFinding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * fingerprint → 병합 레코드 버킷.
 * 단일 병합 패스가 독점 소유한다: 외부로는 snapshot() 복사본만 나간다.
 */
public final class FindingAccumulator {

    private final Map<Fingerprint, MergedFinding> buckets = new LinkedHashMap<>();
    private int folded;

    /** 첫 등장이면 seed, 아니면 reconcile */
    public MergedFinding add(Finding f) {
        folded++;
        Fingerprint key = Fingerprint.of(f);
        MergedFinding existing = buckets.get(key);
        MergedFinding next = (existing == null)
                ? FindingReconciler.seed(f)
                : FindingReconciler.reconcile(existing, f);
        buckets.put(key, next);
        return next;
    }

    public void addAll(Iterable<Finding> findings) {
        for (Finding f : findings) add(f);
    }

    public int size() { return buckets.size(); }

    /** 지금까지 접은 입력 레코드 수 */
    public int folded() { return folded; }

    /** 병합 결과 (최초 등장 순서). 정렬/ID 부여는 FindingPrioritizer 몫 */
    public List<MergedFinding> snapshot() {
        return new ArrayList<>(buckets.values());
    }
}
