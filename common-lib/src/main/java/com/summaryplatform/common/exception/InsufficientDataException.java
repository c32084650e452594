package com.summaryplatform.common.exception;

/**
 * Fewer points or weeks than a fit or grouping needs. Summarizers recover from
 * it by omitting the affected comparison.
 */
public class InsufficientDataException extends SummarizationException {

    public InsufficientDataException(String component, String message) {
        super(component, message);
    }
}
