package com.ryuqq.runnertype.core.spi;

/**
 * Store-level failure: connectivity, store-side validation or constraint violation.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
