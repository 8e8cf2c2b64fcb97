package com.corpusindex.runtime;

/**
 * Invalid configuration detected while wiring the pipeline. Raised before any document is touched.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
