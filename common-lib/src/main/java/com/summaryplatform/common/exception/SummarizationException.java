package com.summaryplatform.common.exception;

/**
 * Root of the summarization error taxonomy. Every failure carries the name of
 * the component that raised it so log lines and HTTP problem bodies can point
 * at the offending service or library routine.
 */
public class SummarizationException extends RuntimeException {
    private final String component;

    public SummarizationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SummarizationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
