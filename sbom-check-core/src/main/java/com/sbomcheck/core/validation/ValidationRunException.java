package com.sbomcheck.core.validation;

/**
 * Thrown when a run as a whole cannot complete, for example when it is interrupted or a worker
 * dies with an {@link Error}. Problems confined to one document never raise it.
 */
public class ValidationRunException extends RuntimeException {

    public ValidationRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
