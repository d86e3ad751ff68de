package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 같은 fingerprint를 공유하는 Finding들을 하나로 합친 결과 (불변).
 * 필드 갱신은 toBuilder()로 새 인스턴스를 만든다.
 *
 * id는 최종 정렬 전까지 "pending".
 */
public final class MergedFinding {
    public static final String PENDING_ID = "pending";

    private final String id;
    private final String fingerprint;
    private final Detector detector;
    private final Tier tier;
    private final Severity severity;
    private final Confidence confidence;
    private final String file;
    private final Integer line;
    private final String summary;
    private final String evidence;
    private final String recommendedFix;
    private final Status status;
    private final String conflictNote;
    private final boolean needsValidation;
    private final List<String> sources;

    private MergedFinding(Builder b) {
        this.id = b.id;
        this.fingerprint = b.fingerprint;
        this.detector = b.detector;
        this.tier = b.tier;
        this.severity = b.severity;
        this.confidence = b.confidence;
        this.file = b.file;
        this.line = b.line;
        this.summary = b.summary;
        this.evidence = b.evidence;
        this.recommendedFix = b.recommendedFix;
        this.status = b.status;
        this.conflictNote = b.conflictNote;
        this.needsValidation = b.needsValidation;
        this.sources = List.copyOf(b.sources);
    }

    @JsonProperty("id") public String getId() { return id; }
    @JsonIgnore public String getFingerprint() { return fingerprint; }
    @JsonProperty("detector") public Detector getDetector() { return detector; }
    @JsonProperty("tier") public Tier getTier() { return tier; }
    @JsonProperty("severity") public Severity getSeverity() { return severity; }
    @JsonProperty("confidence") public Confidence getConfidence() { return confidence; }
    @JsonProperty("file") public String getFile() { return file; }
    @JsonProperty("line") public Integer getLine() { return line; }
    @JsonProperty("summary") public String getSummary() { return summary; }
    @JsonProperty("evidence") public String getEvidence() { return evidence; }
    @JsonProperty("recommended_fix") public String getRecommendedFix() { return recommendedFix; }
    @JsonProperty("status") public Status getStatus() { return status; }
    @JsonProperty("conflict_note") public String getConflictNote() { return conflictNote; }
    @JsonProperty("needs_validation") public boolean isNeedsValidation() { return needsValidation; }
    @JsonProperty("_sources") public List<String> getSources() { return sources; }

    @JsonIgnore public boolean isOpen() { return status == Status.OPEN; }

    public Builder toBuilder() { return new Builder(this); }
    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "MergedFinding{" + id + " " + fingerprint + " " + tier.wire() + "/" + severity.wire()
                + "/" + confidence.wire() + " " + status.wire() + " sources=" + sources.size() + "}";
    }

    public static final class Builder {
        private String id = PENDING_ID;
        private String fingerprint;
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
        private final List<String> sources = new ArrayList<>();

        private Builder() {}

        private Builder(MergedFinding m) {
            this.id = m.id;
            this.fingerprint = m.fingerprint;
            this.detector = m.detector;
            this.tier = m.tier;
            this.severity = m.severity;
            this.confidence = m.confidence;
            this.file = m.file;
            this.line = m.line;
            this.summary = m.summary;
            this.evidence = m.evidence;
            this.recommendedFix = m.recommendedFix;
            this.status = m.status;
            this.conflictNote = m.conflictNote;
            this.needsValidation = m.needsValidation;
            this.sources.addAll(m.sources);
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder fingerprint(String fingerprint) { this.fingerprint = fingerprint; return this; }
        public Builder detector(Detector detector) { this.detector = detector; return this; }
        public Builder tier(Tier tier) { this.tier = tier; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder confidence(Confidence confidence) { this.confidence = confidence; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder evidence(String evidence) { this.evidence = evidence; return this; }
        public Builder recommendedFix(String recommendedFix) { this.recommendedFix = recommendedFix; return this; }
        public Builder status(Status status) { this.status = status; return this; }
        public Builder conflictNote(String conflictNote) { this.conflictNote = conflictNote; return this; }
        public Builder needsValidation(boolean needsValidation) { this.needsValidation = needsValidation; return this; }
        public Builder addSource(String source) { this.sources.add(source == null ? "" : source); return this; }

        public MergedFinding build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(fingerprint, "fingerprint");
            Objects.requireNonNull(detector, "detector");
            Objects.requireNonNull(tier, "tier");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(confidence, "confidence");
            Objects.requireNonNull(status, "status");
            return new MergedFinding(this);
        }
    }
}
