package com.budgetbridge.ynab.error;

public enum FailureKind {
    VALIDATION,
    AUTHENTICATION,
    AUTHORIZATION,
    NOT_FOUND,
    RATE_LIMITED,
    UPSTREAM,
    PERSISTENCE,
    UNKNOWN
}
