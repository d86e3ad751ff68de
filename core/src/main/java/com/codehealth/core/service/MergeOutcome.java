package com.codehealth.core.service;

import com.codehealth.core.model.MergeStats;
import com.codehealth.core.report.Report;

/** 1회 실행 결과: 보고서 + 집계 스냅샷 */
public record MergeOutcome(Report report, MergeStats.Snapshot stats) {}
