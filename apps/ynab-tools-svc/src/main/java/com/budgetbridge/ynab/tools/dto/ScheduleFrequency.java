package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Recurrence values accepted by YNAB for scheduled transactions.
 */
public enum ScheduleFrequency {
    NEVER("never"),
    DAILY("daily"),
    WEEKLY("weekly"),
    EVERY_OTHER_WEEK("everyOtherWeek"),
    TWICE_A_MONTH("twiceAMonth"),
    EVERY_4_WEEKS("every4Weeks"),
    MONTHLY("monthly"),
    EVERY_OTHER_MONTH("everyOtherMonth"),
    EVERY_3_MONTHS("every3Months"),
    EVERY_4_MONTHS("every4Months"),
    TWICE_A_YEAR("twiceAYear"),
    YEARLY("yearly"),
    EVERY_OTHER_YEAR("everyOtherYear");

    private final String wireValue;

    ScheduleFrequency(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ScheduleFrequency fromWire(String value) {
        for (ScheduleFrequency frequency : values()) {
            if (frequency.wireValue.equals(value)) {
                return frequency;
            }
        }
        String allowed = Arrays.stream(values()).map(ScheduleFrequency::wireValue).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("frequency must be one of: " + allowed);
    }
}
