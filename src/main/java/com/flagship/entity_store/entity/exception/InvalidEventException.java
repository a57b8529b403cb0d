package com.flagship.entity_store.entity.exception;

/**
 * An event or command payload does not match the catalog shape for its type.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
