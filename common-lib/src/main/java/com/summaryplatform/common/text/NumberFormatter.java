package com.summaryplatform.common.text;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Formats numbers for summary text: grouping separators and at most two
 * fraction digits ({@code 1234.5678 -> "1,234.57"}, {@code 6.0 -> "6"}).
 */
public final class NumberFormatter {

    private static final String PATTERN = "#,##0.##";

    private NumberFormatter() {}

    public static String formatY(double value) {
        // DecimalFormat is not thread-safe
        DecimalFormat format = new DecimalFormat(PATTERN, DecimalFormatSymbols.getInstance(Locale.US));
        String text = format.format(value);
        return "-0".equals(text) ? "0" : text;
    }
}
