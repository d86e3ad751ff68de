package com.codehealth.core.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** 입력 경로 → JSON 소스 파일 목록 (정렬 보장: 재실행 시 접기 순서가 같아야 함) */
public final class FindingSources {
    private FindingSources() {}

    public static List<Path> list(Path target) throws FindingSourceException {
        if (target == null || !Files.exists(target)) {
            throw new FindingSourceException(target, "Path does not exist: " + target);
        }
        if (Files.isRegularFile(target)) return List.of(target);

        try (Stream<Path> walk = Files.walk(target)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new FindingSourceException(target, "Failed to scan directory: " + target, e);
        }
    }
}
