package com.codehealth.core.model;

/**
 * 병합 1회 실행의 집계 카운터.
 * 엔진이 단일 스레드 배치라 원자 연산은 쓰지 않는다: 실행마다 새로 만든다.
 */
public final class MergeStats {
    private int filesScanned;      // 읽기 시도한 JSON 파일 수
    private int filesFailed;       // 파싱 실패로 격리된 파일 수
    private int sourcesSkipped;    // 컨테이너 형태가 아닌 소스 수
    private int recordsLoaded;     // 정규화까지 통과한 레코드 수
    private int recordsRejected;   // 알 수 없는 enum 값 등으로 버려진 레코드 수
    private int entriesSkipped;    // 객체가 아닌 배열 원소 수
    private int merged;            // 병합 후 레코드 수
    private int conflicted;        // 충돌이 기록된 병합 레코드 수

    public void fileScanned()     { filesScanned++; }
    public void fileFailed()      { filesFailed++; }
    public void sourceSkipped()   { sourcesSkipped++; }
    public void recordLoaded()    { recordsLoaded++; }
    public void recordRejected()  { recordsRejected++; }
    public void entrySkipped()    { entriesSkipped++; }
    public void mergedResult(int mergedCount, int conflictedCount) {
        this.merged = mergedCount;
        this.conflicted = conflictedCount;
    }

    public Snapshot snapshot() {
        return new Snapshot(filesScanned, filesFailed, sourcesSkipped,
                recordsLoaded, recordsRejected, entriesSkipped, merged, conflicted);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int filesScanned;
        public final int filesFailed;
        public final int sourcesSkipped;
        public final int recordsLoaded;
        public final int recordsRejected;
        public final int entriesSkipped;
        public final int merged;
        public final int conflicted;

        public Snapshot(int filesScanned, int filesFailed, int sourcesSkipped,
                        int recordsLoaded, int recordsRejected, int entriesSkipped,
                        int merged, int conflicted) {
            this.filesScanned = filesScanned;
            this.filesFailed = filesFailed;
            this.sourcesSkipped = sourcesSkipped;
            this.recordsLoaded = recordsLoaded;
            this.recordsRejected = recordsRejected;
            this.entriesSkipped = entriesSkipped;
            this.merged = merged;
            this.conflicted = conflicted;
        }

        @Override
        public String toString() {
            return "files=" + filesScanned + " failed=" + filesFailed + " skippedSources=" + sourcesSkipped
                    + " loaded=" + recordsLoaded + " rejected=" + recordsRejected
                    + " skippedEntries=" + entriesSkipped + " merged=" + merged + " conflicted=" + conflicted;
        }
    }
}
