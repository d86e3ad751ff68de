package com.codehealth.core.loader;

import java.nio.file.Path;

/** 경로는 존재하지만 읽을 JSON 소스가 하나도 없음 (CLI 종료 코드 1) */
public class NoSourcesException extends FindingSourceException {
    public NoSourcesException(Path target) {
        super(target, "No JSON files found under: " + target);
    }
}
