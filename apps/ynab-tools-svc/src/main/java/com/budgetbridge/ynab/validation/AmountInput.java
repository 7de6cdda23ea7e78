package com.budgetbridge.ynab.validation;

import com.budgetbridge.ynab.money.MilliunitCodec;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * An amount supplied either as milliunits or as dollars, never both.
 */
public final class AmountInput {

    private final Long milliunits;
    private final BigDecimal dollars;

    private AmountInput(Long milliunits, BigDecimal dollars) {
        this.milliunits = milliunits;
        this.dollars = dollars;
    }

    public static AmountInput ofMilliunits(long milliunits) {
        return new AmountInput(milliunits, null);
    }

    public static AmountInput ofDollars(BigDecimal dollars) {
        return new AmountInput(null, Objects.requireNonNull(dollars, "dollars"));
    }

    /**
     * Milliunit value to send upstream; dollar inputs are truncated toward zero.
     */
    public long toMilliunits() {
        return milliunits != null ? milliunits : MilliunitCodec.toMilliunits(dollars);
    }

    @Override
    public String toString() {
        return milliunits != null ? milliunits + " milliunits" : dollars + " dollars";
    }
}
