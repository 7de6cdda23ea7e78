package com.budgetbridge.ynab.validation;

import com.budgetbridge.ynab.error.ToolValidationException;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Rules for the paired {@code amount_milliunits} / {@code amount_dollars} parameters.
 */
public final class AmountInputValidator {

    static final String EXACTLY_ONE = "Provide exactly one of amount_milliunits or amount_dollars";
    static final String AT_MOST_ONE = "Provide at most one of amount_milliunits or amount_dollars";

    private AmountInputValidator() {
    }

    /**
     * Used by creation and single-amount mutations.
     *
     * @throws ToolValidationException when both or neither are present
     */
    public static AmountInput requireExactlyOne(Long milliunits, BigDecimal dollars) {
        boolean hasMilliunits = milliunits != null;
        boolean hasDollars = dollars != null;
        if (hasMilliunits == hasDollars) {
            throw new ToolValidationException(EXACTLY_ONE);
        }
        return hasMilliunits ? AmountInput.ofMilliunits(milliunits) : AmountInput.ofDollars(dollars);
    }

    /**
     * Used by partial updates; an empty result means the amount is left unchanged.
     *
     * @throws ToolValidationException when both are present
     */
    public static Optional<AmountInput> atMostOne(Long milliunits, BigDecimal dollars) {
        if (milliunits != null && dollars != null) {
            throw new ToolValidationException(AT_MOST_ONE);
        }
        if (milliunits != null) {
            return Optional.of(AmountInput.ofMilliunits(milliunits));
        }
        return Optional.ofNullable(dollars).map(AmountInput::ofDollars);
    }
}
