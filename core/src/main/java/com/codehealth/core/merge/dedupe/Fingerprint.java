package com.codehealth.core.merge.dedupe;

import com.codehealth.core.model.Finding;
import com.codehealth.core.util.TextNormalizer;

/**
 * 중복 억제용 키: (detector, file, 정규화 summary)
 * 같은 키 = 어느 태스크가 냈든 같은 이슈.
 */
public record Fingerprint(String detector, String file, String normalizedSummary) {

    public static Fingerprint of(Finding f) {
        return new Fingerprint(f.getDetector().wire(),
                               f.getFile().trim(),
                               TextNormalizer.normalize(f.getSummary()));
    }

    /** "detector|file|summary" */
    public String key() {
        return detector + "|" + file + "|" + normalizedSummary;
    }

    @Override
    public String toString() { return key(); }
}
