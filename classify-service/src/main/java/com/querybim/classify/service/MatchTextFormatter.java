package com.querybim.classify.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders the {@code match} field of a result record.
 *
 * <pre>
 * match := code ":" title ":" score
 * score := similarity rounded half-up to two decimals, plain notation
 * </pre>
 *
 * Rounding works on the exact binary value of the double, so {@code 1.005} renders as
 * {@code 1.00} and {@code 0.125} as {@code 0.13}. A negative similarity that rounds to
 * zero keeps its sign ({@code -0.004} renders as {@code -0.00}).
 */
public final class MatchTextFormatter {

    public static final String NO_MATCH = "No match found:0.00";
    public static final String EMBEDDING_FAILED = "Embedding failed:0.00";

    private static final char SEPARATOR = ':';

    private MatchTextFormatter() {
    }

    public static String format(String code, String title, double similarity) {
        return (code == null ? "" : code)
                + SEPARATOR
                + (title == null ? "" : title)
                + SEPARATOR
                + formatScore(similarity);
    }

    public static String formatScore(double similarity) {
        if (!Double.isFinite(similarity)) {
            return String.valueOf(similarity);
        }
        BigDecimal rounded = new BigDecimal(similarity).setScale(2, RoundingMode.HALF_UP);
        if (similarity < 0 && rounded.signum() == 0) {
            return "-" + rounded.toPlainString();
        }
        return rounded.toPlainString();
    }
}
