package com.budgetbridge.ynab.money;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MilliunitCodecTest {

    @Test
    void formatsCentsWithDollarSign() {
        assertThat(MilliunitCodec.toDisplay(12_340)).isEqualTo("$12.34");
        assertThat(MilliunitCodec.toDisplay(-500)).isEqualTo("-$0.50");
    }

    @Test
    void formatsNegativeAmountsWithLeadingSign() {
        assertThat(MilliunitCodec.toDisplay(-45_670)).isEqualTo("-$45.67");
    }

    @Test
    void groupsThousands() {
        assertThat(MilliunitCodec.toDisplay(1_234_567_890)).isEqualTo("$1,234,567.89");
        assertThat(MilliunitCodec.toDisplay(0)).isEqualTo("$0.00");
    }

    @Test
    void roundsHalfToEvenOnTheExactValue() {
        assertThat(MilliunitCodec.toDisplay(1_005)).isEqualTo("$1.00");
        assertThat(MilliunitCodec.toDisplay(1_015)).isEqualTo("$1.02");
        assertThat(MilliunitCodec.toDisplay(-2_675)).isEqualTo("-$2.68");
    }

    @Test
    void subCentNegativeStillCarriesSign() {
        assertThat(MilliunitCodec.toDisplay(-4)).isEqualTo("-$0.00");
    }

    @Test
    void dollarsTruncateTowardZero() {
        assertThat(MilliunitCodec.toMilliunits(new BigDecimal("19.99"))).isEqualTo(19_990L);
        assertThat(MilliunitCodec.toMilliunits(new BigDecimal("1.23456"))).isEqualTo(1_234L);
        assertThat(MilliunitCodec.toMilliunits(new BigDecimal("-1.23456"))).isEqualTo(-1_234L);
    }

    @Test
    void doubleInputAvoidsBinaryRepresentationError() {
        assertThat(MilliunitCodec.toMilliunits(19.99)).isEqualTo(19_990L);
        assertThat(MilliunitCodec.toMilliunits(0.1)).isEqualTo(100L);
    }
}
