package com.codehealth.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 병합/점수 실행 설정 (audit.yml 매핑 대상): 순수 설정 보관용.
 * 가중치 표는 고정값이라 여기 두지 않는다(PenaltyWeights 참고).
 */
public final class AuditConfig {

    /** 알 수 없는 enum 값(tier/severity/confidence/status/detector) 처리 정책 */
    public enum UnknownValuePolicy {
        /** 레코드만 버리고 WARN + 카운트 (기본) */
        REJECT,
        /** 실행 전체 중단 */
        FAIL,
        /** 가장 약한 기본값으로 치환 (detector는 닫힌 집합이라 예외적으로 버림) */
        LENIENT
    }

    /** 출력 관련 하위 설정: YAML의 `output:` 섹션과 매핑 */
    public static final class OutputCfg {
        private boolean pretty = true;

        public boolean isPretty() { return pretty; }
        public void setPretty(boolean pretty) { this.pretty = pretty; }
    }

    public static final int DEFAULT_NEXT_LIMIT = 10;

    // ---------- 기본 필드 ----------
    private UnknownValuePolicy unknownValues = UnknownValuePolicy.REJECT;
    private boolean isolateParseErrors = true;   // 디렉터리 스캔 시 파싱 실패 파일만 건너뜀
    private int nextLimit = DEFAULT_NEXT_LIMIT;
    private Set<Tier> quickWinTiers = EnumSet.of(Tier.T3, Tier.T4);
    private Set<Detector> cosmeticDetectors = Arrays.stream(Detector.values())
            .filter(Detector::isCosmetic)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Detector.class)));
    private OutputCfg output = new OutputCfg();

    // ---------- getters ----------
    public UnknownValuePolicy getUnknownValues() { return unknownValues; }
    public boolean isIsolateParseErrors() { return isolateParseErrors; }
    public int getNextLimit() { return nextLimit; }
    public Set<Tier> getQuickWinTiers() { return quickWinTiers; }
    public Set<Detector> getCosmeticDetectors() { return cosmeticDetectors; }
    public OutputCfg getOutput() { return output; }

    // ---------- fluent setters ----------
    public AuditConfig setUnknownValues(UnknownValuePolicy p) {
        this.unknownValues = (p != null ? p : UnknownValuePolicy.REJECT);
        return this;
    }
    public AuditConfig setIsolateParseErrors(boolean v) { this.isolateParseErrors = v; return this; }
    public AuditConfig setNextLimit(int nextLimit) { this.nextLimit = nextLimit; return this; }

    public AuditConfig setQuickWinTiers(Collection<Tier> tiers) {
        this.quickWinTiers = (tiers == null || tiers.isEmpty())
                ? EnumSet.noneOf(Tier.class) : EnumSet.copyOf(tiers);
        return this;
    }
    public AuditConfig setCosmeticDetectors(Collection<Detector> detectors) {
        this.cosmeticDetectors = (detectors == null || detectors.isEmpty())
                ? EnumSet.noneOf(Detector.class) : EnumSet.copyOf(detectors);
        return this;
    }
    public AuditConfig setOutput(OutputCfg output) { this.output = output; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(unknownValues, "unknownValues");
        if (nextLimit < 0) throw new IllegalArgumentException("nextLimit must be >= 0");
        Objects.requireNonNull(quickWinTiers, "quickWinTiers");
        Objects.requireNonNull(cosmeticDetectors, "cosmeticDetectors");
        Objects.requireNonNull(output, "output");
    }

    public static AuditConfig defaults() { return new AuditConfig(); }
}
