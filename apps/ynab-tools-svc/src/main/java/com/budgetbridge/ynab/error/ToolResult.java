package com.budgetbridge.ynab.error;

import java.util.Optional;

/**
 * Outcome of one tool call: either the rendered text or a classified failure.
 */
public final class ToolResult {

    private final String output;
    private final ToolFailure failure;

    private ToolResult(String output, ToolFailure failure) {
        this.output = output;
        this.failure = failure;
    }

    public static ToolResult success(String output) {
        return new ToolResult(output, null);
    }

    public static ToolResult failure(ToolFailure failure) {
        return new ToolResult(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<ToolFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public String render(ErrorClassifier classifier) {
        return isSuccess() ? output : classifier.classify(failure);
    }
}
