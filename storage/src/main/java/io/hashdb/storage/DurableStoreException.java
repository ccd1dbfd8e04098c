package io.hashdb.storage;

/**
 * Failure talking to the durable backing store (I/O error, timeout, corrupt log).
 * The stores translate it to DB_ERROR.
 */
public class DurableStoreException extends RuntimeException {

    public DurableStoreException(String message) {
        super(message);
    }

    public DurableStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
