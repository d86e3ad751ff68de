package com.codehealth.core.loader;

/**
 * 레코드의 enum 필드에 닫힌 집합 밖의 값이 들어온 경우.
 * REJECT 정책에서는 로더가 잡아서 레코드만 버리고, FAIL 정책에서는 그대로 전파된다.
 */
public class InvalidFindingException extends IllegalArgumentException {
    private final String source;
    private final int index;
    private final String field;
    private final String value;

    public InvalidFindingException(String source, int index, String field, String value) {
        super(source + ": finding[" + index + "] invalid " + field + " '" + value + "'");
        this.source = source;
        this.index = index;
        this.field = field;
        this.value = value;
    }

    public String getSource() { return source; }
    public int getIndex() { return index; }
    public String getField() { return field; }
    public String getValue() { return value; }
}
