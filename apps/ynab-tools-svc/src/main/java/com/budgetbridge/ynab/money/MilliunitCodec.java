package com.budgetbridge.ynab.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Converts YNAB milliunit integers (1000 = one currency unit) to display strings and back.
 *
 * <p>Display rounding is HALF_EVEN on the exact decimal value. The reverse conversion truncates toward
 * zero, so sub-milliunit fractions of a dollar input are dropped. Values outside the {@code long} range
 * wrap instead of failing.
 */
public final class MilliunitCodec {

    private static final int MILLIUNIT_SCALE = 3;
    private static final int DISPLAY_SCALE = 2;

    private MilliunitCodec() {
    }

    public static String toDisplay(long milliunits) {
        BigDecimal magnitude = BigDecimal.valueOf(milliunits, MILLIUNIT_SCALE)
                .abs()
                .setScale(DISPLAY_SCALE, RoundingMode.HALF_EVEN);
        String formatted = String.format(Locale.US, "$%,.2f", magnitude);
        return milliunits < 0 ? "-" + formatted : formatted;
    }

    public static long toMilliunits(BigDecimal dollars) {
        return dollars.movePointRight(MILLIUNIT_SCALE)
                .setScale(0, RoundingMode.DOWN)
                .longValue();
    }

    public static long toMilliunits(double dollars) {
        // valueOf goes through Double.toString, so 19.99 stays 19.99 rather than 19.989999...
        return toMilliunits(BigDecimal.valueOf(dollars));
    }
}
