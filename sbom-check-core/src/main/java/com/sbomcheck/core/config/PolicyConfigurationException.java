package com.sbomcheck.core.config;

/**
 * Thrown when a policy configuration is malformed. Raised before any document is evaluated.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
