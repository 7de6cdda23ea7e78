package com.budgetbridge.ynab.money;

import java.util.List;

/**
 * YNAB entity kinds and the fields of each that carry milliunit amounts.
 */
public enum EntityKind {
    ACCOUNT(List.of("balance", "cleared_balance", "uncleared_balance")),
    CATEGORY(List.of("budgeted", "activity", "balance", "goal_target", "goal_overall_left")),
    TRANSACTION(List.of("amount")),
    SCHEDULED_TRANSACTION(List.of("amount")),
    MONTH_BUDGET(List.of("income", "budgeted", "activity", "to_be_budgeted"));

    public static final String MILLIUNITS_SUFFIX = "_milliunits";

    private final List<String> monetaryFields;

    EntityKind(List<String> monetaryFields) {
        this.monetaryFields = monetaryFields;
    }

    public List<String> monetaryFields() {
        return monetaryFields;
    }

    public static String milliunitsField(String field) {
        return field + MILLIUNITS_SUFFIX;
    }
}
