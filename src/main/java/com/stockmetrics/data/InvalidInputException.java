package com.stockmetrics.data;

/**
 * Raised when the price panel violates its schema. Always fatal for the whole run.
 */
public class InvalidInputException extends IllegalArgumentException {
    private final InputErrorCode code;

    public InvalidInputException(InputErrorCode code, String message) {
        super(code + ": " + message);
        this.code = code;
    }

    public InvalidInputException(InputErrorCode code, String message, Throwable cause) {
        super(code + ": " + message, cause);
        this.code = code;
    }

    public InputErrorCode code() {
        return code;
    }
}
