package com.summaryplatform.common.exception;

/**
 * Non-numeric or NaN input handed to a membership or trend routine.
 */
public class InvalidInputException extends SummarizationException {

    public InvalidInputException(String component, String message) {
        super(component, message);
    }
}
