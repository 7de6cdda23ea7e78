package com.budgetbridge.ynab.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ResponseFormat {
    MARKDOWN("markdown"),
    JSON("json");

    private final String wireValue;

    ResponseFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ResponseFormat fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResponseFormat format : values()) {
            if (format.wireValue.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("response_format must be 'markdown' or 'json'");
    }
}
