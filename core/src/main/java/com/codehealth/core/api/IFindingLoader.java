// IFindingLoader.java
package com.codehealth.core.api;

import com.codehealth.core.loader.FindingSourceException;
import com.codehealth.core.model.Finding;
import com.codehealth.core.model.MergeStats;

import java.nio.file.Path;
import java.util.List;

/** 로더 최소 계약: 경로(파일/디렉터리)를 받아 정규화된 Finding 평면 목록을 돌려준다. */
public interface IFindingLoader {
    List<Finding> load(Path target, MergeStats stats) throws FindingSourceException;
}
