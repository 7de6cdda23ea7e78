package com.budgetbridge.ynab.error;

/**
 * Non-2xx response from the YNAB API.
 */
public class YnabApiException extends RuntimeException {

    private final int status;
    private final String reason;

    public YnabApiException(int status, String reason, Throwable cause) {
        super("YNAB API responded " + status + ": " + reason, cause);
        this.status = status;
        this.reason = reason;
    }

    public int status() {
        return status;
    }

    public String reason() {
        return reason;
    }
}
