package com.company.powersense.exception;

/**
 * Upstream source cannot be used at all (missing or malformed URL). Fatal for the pass, never retried.
 */
public class UpstreamConfigurationException extends RuntimeException {
    public UpstreamConfigurationException(String message) {
        super(message);
    }

    public UpstreamConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
