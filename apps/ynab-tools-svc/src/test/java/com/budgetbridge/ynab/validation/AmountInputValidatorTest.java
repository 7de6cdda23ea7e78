package com.budgetbridge.ynab.validation;

import com.budgetbridge.ynab.error.ToolValidationException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountInputValidatorTest {

    @Test
    void exactlyOneRejectsBoth() {
        assertThatThrownBy(() -> AmountInputValidator.requireExactlyOne(10_000L, new BigDecimal("10")))
                .isInstanceOf(ToolValidationException.class)
                .hasMessage(AmountInputValidator.EXACTLY_ONE);
    }

    @Test
    void exactlyOneRejectsNeither() {
        assertThatThrownBy(() -> AmountInputValidator.requireExactlyOne(null, null))
                .isInstanceOf(ToolValidationException.class)
                .hasMessage(AmountInputValidator.EXACTLY_ONE);
    }

    @Test
    void dollarsAreConvertedToMilliunits() {
        AmountInput amount = AmountInputValidator.requireExactlyOne(null, new BigDecimal("-19.99"));

        assertThat(amount.toMilliunits()).isEqualTo(-19_990L);
    }

    @Test
    void milliunitsPassThrough() {
        assertThat(AmountInputValidator.requireExactlyOne(-5_000L, null).toMilliunits()).isEqualTo(-5_000L);
    }

    @Test
    void atMostOneAllowsNeither() {
        assertThat(AmountInputValidator.atMostOne(null, null)).isEmpty();
    }

    @Test
    void atMostOneRejectsBoth() {
        assertThatThrownBy(() -> AmountInputValidator.atMostOne(1L, BigDecimal.ONE))
                .isInstanceOf(ToolValidationException.class)
                .hasMessage(AmountInputValidator.AT_MOST_ONE);
    }
}
