package com.budgetbridge.ynab.tools.dto;

final class ToolPatterns {

    static final String ISO_DATE = "^\\d{4}-\\d{2}-\\d{2}$";
    static final String ISO_DATE_MESSAGE = "must be a date in YYYY-MM-DD format";

    private ToolPatterns() {
    }
}
