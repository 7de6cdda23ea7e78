package com.budgetbridge.ynab.error;

/**
 * Malformed or contradictory tool parameters. Raised before any call reaches the YNAB API.
 */
public class ToolValidationException extends RuntimeException {

    public ToolValidationException(String message) {
        super(message);
    }

    public ToolValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
