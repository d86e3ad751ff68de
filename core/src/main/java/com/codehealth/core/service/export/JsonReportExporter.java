package com.codehealth.core.service.export;

import com.codehealth.core.report.Report;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 보고서 JSON Exporter.
 * - 모든 레벨 키 알파벳 정렬(프로퍼티 + Map 엔트리) → 같은 입력이면 바이트 단위 동일
 * - pretty=true: 2칸 들여쓰기, 배열도 줄바꿈
 * - 파일 출력은 끝에 개행 1개
 */
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper om = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build();

    private final boolean pretty;

    public JsonReportExporter() { this(true); }

    public JsonReportExporter(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public Path export(Report report, Path outFile) throws IOException {
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outFile, toJson(report) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return outFile;
    }

    @Override
    public void write(Report report, OutputStream out) throws IOException {
        out.write((toJson(report) + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    public String toJson(Report report) throws IOException {
        return writer().writeValueAsString(report);
    }

    private ObjectWriter writer() {
        if (!pretty) return om.writer();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        // "key": value (콜론 뒤에만 공백)
        Separators seps = Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER);
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter()
                .withSeparators(seps)
                .withObjectIndenter(indenter);
        pp.indentArraysWith(indenter);
        return om.writer(pp);
    }
}
