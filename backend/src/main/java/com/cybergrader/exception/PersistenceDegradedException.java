package com.cybergrader.exception;

/**
 * The durable backend could not complete an operation. Only ever thrown by
 * durable backends and caught by the persisting store; request callers never
 * see it.
 */
public class PersistenceDegradedException extends RuntimeException {

    public PersistenceDegradedException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceDegradedException(String message) {
        super(message);
    }
}
