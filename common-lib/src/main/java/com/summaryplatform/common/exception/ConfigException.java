package com.summaryplatform.common.exception;

/**
 * Malformed or missing configuration. Raised before any computation starts
 * and never retried.
 */
public class ConfigException extends SummarizationException {

    public ConfigException(String component, String message) {
        super(component, message);
    }
}
