package com.codehealth.core.loader;

import java.io.IOException;
import java.nio.file.Path;

/** 입력 경로 부재 / 읽기 실패 / JSON 파싱 실패: 실행 단위에서 치명적 */
public class FindingSourceException extends IOException {
    private final transient Path source;

    public FindingSourceException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public FindingSourceException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() { return source; }
}
