package com.codehealth.core.service.export;

import com.codehealth.core.report.Report;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/** 병합 보고서를 내보내는 책임 (현재 JSON만) */
public interface ReportExporter {
    /**
     * @param report  병합 보고서
     * @param outFile 출력 파일 (부모 디렉터리 자동 생성, 덮어쓰기)
     * @return 생성된 파일의 경로
     */
    Path export(Report report, Path outFile) throws IOException;

    /** 스트림으로 출력 (표준 출력 등). 스트림은 닫지 않는다. */
    void write(Report report, OutputStream out) throws IOException;
}
