package com.budgetbridge.ynab.error;

/**
 * Classified failure of a tool call.
 *
 * @param kind   failure category
 * @param status upstream HTTP status, or {@code null} for local failures
 * @param name   failure kind name shown to the caller for local failures
 * @param detail upstream reason text or local failure description
 */
public record ToolFailure(FailureKind kind, Integer status, String name, String detail) {

    public static ToolFailure from(Throwable error) {
        if (error instanceof YnabApiException api) {
            return new ToolFailure(kindForStatus(api.status()), api.status(), "YnabApiError", api.reason());
        }
        if (error instanceof ToolValidationException) {
            return new ToolFailure(FailureKind.VALIDATION, null, "ValidationError", error.getMessage());
        }
        if (error instanceof SpillWriteException) {
            return new ToolFailure(FailureKind.PERSISTENCE, null, "LocalPersistenceError", error.getMessage());
        }
        return new ToolFailure(FailureKind.UNKNOWN, null, error.getClass().getSimpleName(), error.getMessage());
    }

    static FailureKind kindForStatus(int status) {
        return switch (status) {
            case 401 -> FailureKind.AUTHENTICATION;
            case 403 -> FailureKind.AUTHORIZATION;
            case 404 -> FailureKind.NOT_FOUND;
            case 429 -> FailureKind.RATE_LIMITED;
            default -> FailureKind.UPSTREAM;
        };
    }
}
