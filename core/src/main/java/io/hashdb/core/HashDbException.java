package io.hashdb.core;

import java.util.Objects;

/**
 * Failure raised by the engine and the stores, carrying the result code that
 * the service layer reports back to the caller.
 */
public class HashDbException extends RuntimeException {

    private final ResultCode code;

    public HashDbException(ResultCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public HashDbException(ResultCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ResultCode code() {
        return code;
    }

    public static HashDbException keyNotFound(FieldElementTuple hash) {
        return new HashDbException(ResultCode.DB_KEY_NOT_FOUND, "hash not found: " + hash.toHex());
    }

    public static HashDbException invalidDataSize(FieldElementTuple hash, int size) {
        return new HashDbException(ResultCode.SMT_INVALID_DATA_SIZE,
                "invalid data size " + size + " for node " + hash.toHex());
    }
}
