package io.hashdb.core.smt;

/**
 * Case taken by a Set, reported to callers for observability.
 */
public enum SetMode {
    UPDATE("update"),
    INSERT_EXISTING("insertExisting"),
    INSERT_NOT_FOUND("insertNotFound"),
    DELETE_FOUND("deleteFound"),
    DELETE_LAST("deleteLast"),
    DELETE_NOT_FOUND("deleteNotFound"),
    ZERO_TO_ZERO("zeroToZero");

    private final String wireName;

    SetMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isNoOp() {
        return this == DELETE_NOT_FOUND || this == ZERO_TO_ZERO;
    }
}
