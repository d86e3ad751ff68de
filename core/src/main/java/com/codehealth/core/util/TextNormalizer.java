package com.codehealth.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    /**
     * fingerprint용 요약 정규화: 소문자화 → [a-z0-9] 외 연속 구간을 공백 하나로 → trim.
     * "Unused  func()!" → "unused func"
     */
    public static String normalize(String s) {
        if (s == null || s.isEmpty()) return "";
        String lower = s.toLowerCase(Locale.ROOT);
        return NON_ALNUM.matcher(lower).replaceAll(" ").trim();
    }
}
