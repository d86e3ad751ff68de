package com.codehealth.core.model;

import java.util.Locale;
import java.util.Optional;

/** JSON 표기(wire name)를 가진 닫힌 열거형 공통 계약 */
public interface WireNamed {

    /** JSON 상의 표기 ("T1", "high", "dead_unused_code" ...) */
    String wire();

    /**
     * wire name으로 상수 조회. 앞뒤 공백/대소문자 무시.
     * 알 수 없는 값이면 empty: 기본값 치환 여부는 호출 측 정책이 결정한다.
     */
    static <E extends Enum<E> & WireNamed> Optional<E> lookup(Class<E> type, String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return Optional.empty();
        for (E e : type.getEnumConstants()) {
            if (e.wire().toLowerCase(Locale.ROOT).equals(s)) return Optional.of(e);
        }
        return Optional.empty();
    }
}
