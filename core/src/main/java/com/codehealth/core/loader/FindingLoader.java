package com.codehealth.core.loader;

import com.codehealth.core.api.IFindingLoader;
import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.model.AuditConfig.UnknownValuePolicy;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.MergeStats;
import com.codehealth.core.util.StructuredLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON 소스 로더.
 *  - 소스 = 평면 배열 또는 {"findings": [...]} 객체. 그 외 형태는 0건(경고만)
 *  - 배열 원소 중 객체가 아닌 값은 건너뜀
 *  - 파싱 실패: 단일 파일이면 실행 중단, 디렉터리면 isolateParseErrors 설정에 따라 격리/중단
 *  - 각 레코드에 출처(파일 경로) 태깅
 */
public final class FindingLoader implements IFindingLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FindingLoader.class);
    private static final StructuredLog SLOG = StructuredLog.get(FindingLoader.class);

    private final ObjectMapper om = new ObjectMapper();
    private final AuditConfig cfg;
    private final RawFindingMapper mapper;

    public FindingLoader(AuditConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.mapper = new RawFindingMapper(cfg.getUnknownValues());
    }

    @Override
    public List<Finding> load(Path target, MergeStats stats) throws FindingSourceException {
        List<Path> files = FindingSources.list(target);
        if (files.isEmpty()) throw new NoSourcesException(target);

        final boolean singleFile = Files.isRegularFile(target);
        List<Finding> out = new ArrayList<>();

        for (Path file : files) {
            stats.fileScanned();

            JsonNode root;
            try {
                root = readTree(file);
            } catch (FindingSourceException e) {
                if (singleFile || !cfg.isIsolateParseErrors()) throw e;
                stats.fileFailed();
                LOG.warn("Skipping unreadable source {}: {}", file, e.getMessage());
                SLOG.warn("source-failed", "file", file, "reason", e.getMessage());
                continue;
            }

            JsonNode records = container(root);
            if (records == null) {
                stats.sourceSkipped();
                LOG.warn("Skipping {}: root is neither an array nor an object with a 'findings' array", file);
                SLOG.warn("source-skipped", "file", file, "rootType", root.getNodeType());
                continue;
            }

            int loaded = 0;
            for (int i = 0; i < records.size(); i++) {
                JsonNode el = records.get(i);
                if (!el.isObject()) {
                    stats.entrySkipped();
                    LOG.debug("{}: finding[{}] is not an object, skipped", file, i);
                    continue;
                }
                try {
                    out.add(mapper.map(el, file.toString(), i));
                    stats.recordLoaded();
                    loaded++;
                } catch (InvalidFindingException e) {
                    if (cfg.getUnknownValues() == UnknownValuePolicy.FAIL) throw e;
                    stats.recordRejected();
                    LOG.warn("Rejected record: {}", e.getMessage());
                    SLOG.warn("record-rejected",
                            "file", file, "index", i, "field", e.getField(), "value", e.getValue());
                }
            }
            LOG.debug("Loaded {} record(s) from {}", loaded, file);
            SLOG.debug("source-loaded", "file", file, "records", loaded);
        }
        return out;
    }

    private JsonNode readTree(Path file) throws FindingSourceException {
        JsonNode root;
        try {
            root = om.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new FindingSourceException(file, "Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FindingSourceException(file, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new FindingSourceException(file, "Invalid JSON in " + file + ": empty document");
        }
        return root;
    }

    /** 배열 자체 또는 findings 배열. 해당 없으면 null */
    static JsonNode container(JsonNode root) {
        if (root.isArray()) return root;
        if (root.isObject()) {
            JsonNode f = root.get("findings");
            if (f != null && f.isArray()) return f;
        }
        return null;
    }
}
