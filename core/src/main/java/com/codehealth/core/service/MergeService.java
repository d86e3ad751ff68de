package com.codehealth.core.service;

import com.codehealth.core.api.IFindingLoader;
import com.codehealth.core.loader.FindingLoader;
import com.codehealth.core.loader.FindingSourceException;
import com.codehealth.core.merge.FindingAccumulator;
import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.MergeStats;
import com.codehealth.core.model.MergedFinding;
import com.codehealth.core.rank.FindingPrioritizer;
import com.codehealth.core.report.Report;
import com.codehealth.core.report.ReportAssembler;
import com.codehealth.core.util.ProgressListener;
import com.codehealth.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 병합 오케스트레이터:
 *  - load → merge(fold) → rank → score/report
 *  - 단일 스레드 배치. 실행마다 새 누적기를 만들므로 순차 재사용 가능
 *  - DI 생성자는 테스트/다른 소스 로더 주입용
 */
public final class MergeService {

    private static final Logger LOG = LoggerFactory.getLogger(MergeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(MergeService.class);

    private final AuditConfig config;
    private final IFindingLoader loader;
    private final ReportAssembler assembler;

    /** 기본 구현(JSON 파일 로더) */
    public MergeService(AuditConfig config) {
        this(config, new FindingLoader(config));
    }

    /** DI/테스트용 */
    public MergeService(AuditConfig config, IFindingLoader loader) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.loader = Objects.requireNonNull(loader, "loader");
        this.assembler = new ReportAssembler(config);
    }

    public MergeOutcome run(Path target) throws FindingSourceException {
        return run(target, ProgressListener.NONE);
    }

    public MergeOutcome run(Path target, ProgressListener listener) throws FindingSourceException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final MergeStats stats = new MergeStats();

        LOG.info("Merge start: target={}, unknownValues={}, nextLimit={}",
                target, config.getUnknownValues(), config.getNextLimit());
        SLOG.info("merge-start",
                "target", String.valueOf(target),
                "unknownValues", String.valueOf(config.getUnknownValues()),
                "isolateParseErrors", config.isIsolateParseErrors());

        // ---- 0) 로드 (전부 메모리에 올린 뒤 병합 시작) ----
        pl.onProgress(0.0, "load", 0, -1);
        List<Finding> loaded = loader.load(target, stats);

        Report report = merge(loaded, stats, pl);

        MergeStats.Snapshot snap = stats.snapshot();
        LOG.info("Merge done. {} overall={} strict={}",
                snap, report.scores().overallScore(), report.scores().strictScore());
        SLOG.info("merge-done",
                "files", snap.filesScanned,
                "failedFiles", snap.filesFailed,
                "records", snap.recordsLoaded,
                "rejected", snap.recordsRejected,
                "merged", snap.merged,
                "conflicted", snap.conflicted,
                "overall", report.scores().overallScore(),
                "strict", report.scores().strictScore());
        return new MergeOutcome(report, snap);
    }

    /** 이미 메모리에 있는 레코드 병합 (로더 우회) */
    public Report merge(Collection<Finding> findings) {
        return merge(findings, new MergeStats(), ProgressListener.NONE);
    }

    private Report merge(Collection<Finding> findings, MergeStats stats, ProgressListener pl) {
        final int total = findings.size();

        // ---- 1) fold ----
        pl.onProgress(0.0, "merge", 0, total);
        FindingAccumulator acc = new FindingAccumulator();
        for (Finding f : findings) {
            acc.add(f);
        }
        pl.onProgress(1.0, "merge", acc.folded(), total);

        List<MergedFinding> merged = acc.snapshot();
        int conflicted = (int) merged.stream().filter(MergedFinding::isNeedsValidation).count();
        stats.mergedResult(merged.size(), conflicted);
        LOG.debug("Folded {} record(s) into {} merged finding(s)", total, merged.size());

        // ---- 2) 정렬 + ID ----
        pl.onProgress(0.0, "rank", 0, merged.size());
        List<MergedFinding> ranked = FindingPrioritizer.rank(merged);
        pl.onProgress(1.0, "rank", ranked.size(), ranked.size());

        // ---- 3) 점수/보고서 ----
        Report report = assembler.assemble(ranked);
        pl.onProgress(1.0, "report", ranked.size(), ranked.size());
        return report;
    }
}
