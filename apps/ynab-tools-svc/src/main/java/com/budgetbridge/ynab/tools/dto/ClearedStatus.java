package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClearedStatus {
    CLEARED("cleared"),
    UNCLEARED("uncleared"),
    RECONCILED("reconciled");

    private final String wireValue;

    ClearedStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * A blank value means "not given": creates fall back to uncleared, updates leave the status alone.
     */
    @JsonCreator
    public static ClearedStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ClearedStatus status : values()) {
            if (status.wireValue.equals(value.strip())) {
                return status;
            }
        }
        throw new IllegalArgumentException("cleared must be one of 'cleared', 'uncleared', 'reconciled'");
    }
}
