package com.example.agencyworkflow.document;

/**
 * Thrown when an imported workflow document cannot be parsed at all. The message is fixed;
 * the parser's detail is kept only as the cause.
 */
public class InvalidWorkflowJsonException extends RuntimeException {

    public static final String MESSAGE = "Invalid workflow JSON format";

    public InvalidWorkflowJsonException(Throwable cause) {
        super(MESSAGE, cause);
    }

    public InvalidWorkflowJsonException() {
        super(MESSAGE);
    }
}
