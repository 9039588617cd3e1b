/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io.codec;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Numeric token handling shared by decoding and encoding.
 *
 * <p>Accepted float syntax: optional sign, decimal digits with optional
 * fraction and exponent ({@code 1}, {@code -2.5}, {@code .5}, {@code 3.},
 * {@code 1e-7}), plus {@code inf}, {@code infinity} and {@code nan} in any case.
 * Java-only forms such as {@code 1.0d} or hexadecimal literals are rejected.</p>
 *
 * <p>Formatting is canonical: integral values have no fraction ({@code 10}),
 * other values use the plain decimal form of {@link Double#toString(double)}
 * without exponent, negative zero is {@code -0}. Every formatted value parses
 * back to the identical {@code double}.</p>
 */
public final class FloatTokens {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("\\+?\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t]+");

    private FloatTokens() {}

    public static String[] split(String values, TokenizationPolicy policy) {
        return switch (policy) {
            case STRICT -> values.split(" ", -1);
            case WHITESPACE -> values.isEmpty() ? new String[0] : WHITESPACE.split(values, -1);
        };
    }

    public static double parseDouble(String token) {
        if (DECIMAL.matcher(token).matches()) {
            return Double.parseDouble(token);
        }
        String lower = token.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String body = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
        switch (body) {
            case "inf", "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                throw new NumberFormatException("Not a number: \"" + token + "\"");
        }
    }

    /**
     * Parses a non-negative decimal integer, as used for the time header.
     */
    public static long parseTime(String token) {
        if (!INTEGER.matcher(token).matches()) {
            throw new NumberFormatException("Not a non-negative integer: \"" + token + "\"");
        }
        return Long.parseLong(token);
    }

    public static String format(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (v == Double.POSITIVE_INFINITY) return "inf";
        if (v == Double.NEGATIVE_INFINITY) return "-inf";
        if (v == 0.0) {
            return Double.doubleToRawLongBits(v) < 0 ? "-0" : "0";
        }
        return new BigDecimal(Double.toString(v)).stripTrailingZeros().toPlainString();
    }

    static void appendJoined(StringBuilder sb, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(format(values[i]));
        }
    }
}
