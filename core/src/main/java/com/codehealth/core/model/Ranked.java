package com.codehealth.core.model;

/** 강도 순위를 갖는 필드(tier/severity/confidence). rank가 클수록 강하다. */
public interface Ranked extends WireNamed {
    int rank();

    /** 둘 중 강한 쪽. 같으면 current 유지 */
    static <E extends Ranked> E stronger(E current, E candidate) {
        return candidate.rank() > current.rank() ? candidate : current;
    }
}
