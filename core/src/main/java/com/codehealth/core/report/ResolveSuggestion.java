package com.codehealth.core.report;

import com.codehealth.core.model.MergedFinding;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** 운영자용 해결 명령 예시. 자동 적용하지 않는다. */
public record ResolveSuggestion(@JsonProperty("id") String id,
                                @JsonProperty("commands") List<String> commands) {

    public static final String WONTFIX_NOTE = "risk accepted or intentional pattern";
    public static final String FALSE_POSITIVE_NOTE = "heuristic mismatch, verify manually";

    public static ResolveSuggestion forFinding(MergedFinding m) {
        String id = m.getId();
        return new ResolveSuggestion(id, List.of(
                "resolve fixed " + id,
                "resolve wontfix " + id + " --note \"" + WONTFIX_NOTE + "\"",
                "resolve false_positive " + id + " --note \"" + FALSE_POSITIVE_NOTE + "\""));
    }
}
