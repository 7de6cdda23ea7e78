package com.budgetbridge.ynab.error;

import org.springframework.stereotype.Component;

/**
 * Maps a {@link ToolFailure} to the text returned to the caller. Never throws.
 */
@Component
public class ErrorClassifier {

    public String classify(ToolFailure failure) {
        return switch (failure.kind()) {
            case AUTHENTICATION -> "Error: Invalid API key. Check YNAB_API_KEY environment variable.";
            case AUTHORIZATION -> "Error: Access forbidden. You don't have permission for this resource.";
            case NOT_FOUND -> "Error: Resource not found. Check the ID is correct.";
            case RATE_LIMITED -> "Error: Rate limit exceeded. Wait before making more requests.";
            case UPSTREAM -> "Error: YNAB API error " + failure.status() + ": " + failure.detail();
            case VALIDATION, PERSISTENCE, UNKNOWN -> "Error: " + failure.name() + ": " + failure.detail();
        };
    }

    public String classify(Throwable error) {
        return classify(ToolFailure.from(error));
    }
}
