package com.sbomcheck.core.loader;

/**
 * Thrown when a document cannot be read or is not valid JSON.
 *
 * <p>Load failures are reported per document and never abort a run.
 */
public class DocumentLoadException extends Exception {

    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
