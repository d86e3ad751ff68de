package com.codehealth.core.model;

import java.util.Objects;

/**
 * 분석 태스크 하나가 보고한 단일 이슈 (병합 전).
 * 모든 필드는 정규화 단계에서 채워진다: 여기서부터는 결측을 허용하지 않는다(line 제외).
 */
public final class Finding {
    private final String taskId;          // 태스크가 붙인 로컬 id (진단용, 출력 안 함)
    private final Detector detector;
    private final Tier tier;
    private final Severity severity;
    private final Confidence confidence;
    private final String file;
    private final Integer line;           // 1 이상 또는 null
    private final String summary;
    private final String evidence;
    private final String recommendedFix;
    private final Status status;
    private final String conflictNote;
    private final boolean needsValidation;
    private final String source;          // 출처(소스 파일 경로)

    private Finding(Builder b) {
        this.taskId = b.taskId;
        this.detector = b.detector;
        this.tier = b.tier;
        this.severity = b.severity;
        this.confidence = b.confidence;
        this.file = b.file;
        this.line = (b.line != null && b.line > 0) ? b.line : null;
        this.summary = b.summary;
        this.evidence = b.evidence;
        this.recommendedFix = b.recommendedFix;
        this.status = b.status;
        this.conflictNote = b.conflictNote;
        this.needsValidation = b.needsValidation;
        this.source = b.source;
    }

    public String getTaskId() { return taskId; }
    public Detector getDetector() { return detector; }
    public Tier getTier() { return tier; }
    public Severity getSeverity() { return severity; }
    public Confidence getConfidence() { return confidence; }
    public String getFile() { return file; }
    public Integer getLine() { return line; }
    public String getSummary() { return summary; }
    public String getEvidence() { return evidence; }
    public String getRecommendedFix() { return recommendedFix; }
    public Status getStatus() { return status; }
    public String getConflictNote() { return conflictNote; }
    public boolean isNeedsValidation() { return needsValidation; }
    public String getSource() { return source; }

    @Override
    public String toString() {
        return "Finding{" + detector.wire() + " " + tier.wire() + " " + file
                + (line == null ? "" : ":" + line) + " '" + summary + "' from " + source + "}";
    }

    public static Builder builder() { return new Builder(); }

    /** 기본값 = 가장 보수적인 값(T4/low/low/open, 빈 텍스트) */
    public static final class Builder {
        private String taskId = "";
        private Detector detector;
        private Tier tier = Tier.T4;
        private Severity severity = Severity.LOW;
        private Confidence confidence = Confidence.LOW;
        private String file = "";
        private Integer line;
        private String summary = "";
        private String evidence = "";
        private String recommendedFix = "";
        private Status status = Status.OPEN;
        private String conflictNote = "";
        private boolean needsValidation;
        private String source = "";

        public Builder taskId(String taskId) { this.taskId = nz(taskId); return this; }
        public Builder detector(Detector detector) { this.detector = detector; return this; }
        public Builder tier(Tier tier) { this.tier = tier; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder confidence(Confidence confidence) { this.confidence = confidence; return this; }
        public Builder file(String file) { this.file = nz(file); return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder summary(String summary) { this.summary = nz(summary); return this; }
        public Builder evidence(String evidence) { this.evidence = nz(evidence); return this; }
        public Builder recommendedFix(String recommendedFix) { this.recommendedFix = nz(recommendedFix); return this; }
        public Builder status(Status status) { this.status = status; return this; }
        public Builder conflictNote(String conflictNote) { this.conflictNote = nz(conflictNote); return this; }
        public Builder needsValidation(boolean needsValidation) { this.needsValidation = needsValidation; return this; }
        public Builder source(String source) { this.source = nz(source); return this; }

        public Finding build() {
            Objects.requireNonNull(detector, "detector");
            Objects.requireNonNull(tier, "tier");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(confidence, "confidence");
            Objects.requireNonNull(status, "status");
            return new Finding(this);
        }

        private static String nz(String s) { return s == null ? "" : s.trim(); }
    }
}
