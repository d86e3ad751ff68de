package com.codehealth.core.loader;

import com.codehealth.core.model.AuditConfig.UnknownValuePolicy;
import com.codehealth.core.model.Confidence;
import com.codehealth.core.model.Detector;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.Severity;
import com.codehealth.core.model.Status;
import com.codehealth.core.model.Tier;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 원시 JSON 객체 → 완전히 채워진 Finding.
 * 결측/형식 불량 필드는 문서화된 기본값으로, 닫힌 집합 밖의 enum 값은 정책에 따라 처리.
 *
 * 텍스트: 문자열은 trim, 숫자/불리언은 텍스트로, null/배열/객체는 결측.
 * line: 1 이상 정수만 유지. needs_validation: JSON true 일 때만 true.
 */
public final class RawFindingMapper {

    private final UnknownValuePolicy policy;

    public RawFindingMapper(UnknownValuePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @throws InvalidFindingException detector 결측/미지 값(정책 무관), 또는 LENIENT가 아닐 때의 미지 enum 값
     */
    public Finding map(JsonNode node, String source, int index) {
        String rawDetector = text(node, "detector");
        Detector detector = Detector.fromWire(rawDetector)
                .orElseThrow(() -> new InvalidFindingException(source, index, "detector", rawDetector));

        return Finding.builder()
                .taskId(text(node, "id"))
                .detector(detector)
                .tier(enumField(node, "tier", Tier::fromWire, Tier.T4, source, index))
                .severity(enumField(node, "severity", Severity::fromWire, Severity.LOW, source, index))
                .confidence(enumField(node, "confidence", Confidence::fromWire, Confidence.LOW, source, index))
                .status(enumField(node, "status", Status::fromWire, Status.OPEN, source, index))
                .file(text(node, "file"))
                .line(line(node))
                .summary(text(node, "summary"))
                .evidence(text(node, "evidence"))
                .recommendedFix(text(node, "recommended_fix"))
                .conflictNote(text(node, "conflict_note"))
                .needsValidation(flag(node, "needs_validation"))
                .source(source)
                .build();
    }

    private <E> E enumField(JsonNode node, String field, Function<String, Optional<E>> parser,
                            E fallback, String source, int index) {
        String raw = text(node, field);
        if (raw.isEmpty()) return fallback;               // 결측 → 기본값
        Optional<E> v = parser.apply(raw);
        if (v.isPresent()) return v.get();
        if (policy == UnknownValuePolicy.LENIENT) return fallback;
        throw new InvalidFindingException(source, index, field, raw);
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode() || v.isMissingNode()) return "";
        return v.asText("").trim();
    }

    static Integer line(JsonNode node) {
        JsonNode v = node.get("line");
        if (v == null || !v.isIntegralNumber() || !v.canConvertToInt()) return null;
        int n = v.intValue();
        return n >= 1 ? n : null;
    }

    static boolean flag(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isBoolean() && v.booleanValue();
    }
}
