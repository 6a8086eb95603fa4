package com.tinypool.exception;

/**
 * Base exception for tiny-pool.
 */
public class PoolException extends RuntimeException {

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
