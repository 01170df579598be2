package com.dinoventures.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Display formatting for currency amounts: thousands separators, exactly two
 * fraction digits, half-up rounding. Amounts are never rounded before display.
 */
public final class Money {

    private static final String PATTERN = "#,##0.00";

    private Money() {
    }

    public static String format(BigDecimal amount) {
        // DecimalFormat is not thread-safe, so build one per call
        DecimalFormat format = new DecimalFormat(PATTERN, DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(amount);
    }
}
