/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io.codec;

import ai.evacortex.oxtraj.core.Configuration;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryFormatException;

import java.util.List;

/**
 * Text codec for a single configuration block.
 *
 * Block layout:
 * <pre>
 *   t = &lt;time&gt;
 *   b = &lt;x&gt; &lt;y&gt; &lt;z&gt;
 *   E = &lt;e0&gt; &lt;e1&gt; &lt;e2&gt;
 *   &lt;15 values&gt;      (one line per particle, zero or more)
 * </pre>
 *
 * Decoding is all-or-nothing: the first bad line fails the whole block with a
 * {@link TrajectoryFormatException} that quotes it.
 */
public final class ConfigurationCodec {

    public static final String TIME_PREFIX = "t";
    public static final String BOX_PREFIX = "b";
    public static final String ENERGY_PREFIX = "E";

    private static final int HEADER_LINES = 3;

    private ConfigurationCodec() {}

    public static Configuration decode(List<String> lines) {
        return decode(lines, TokenizationPolicy.STRICT);
    }

    /**
     * Decodes one block from its raw lines, header lines first.
     *
     * @param lines  block lines without line terminators
     * @param policy how numeric values are split
     * @return the decoded configuration
     * @throws TrajectoryFormatException if any line is malformed
     */
    public static Configuration decode(List<String> lines, TokenizationPolicy policy) {
        String timeText = headerValue(lines, 0, TIME_PREFIX, "time");
        long time;
        try {
            time = FloatTokens.parseTime(timeText);
        } catch (NumberFormatException e) {
            throw new TrajectoryFormatException("Invalid time header value \"" + timeText + "\"", e);
        }

        String boxText = headerValue(lines, 1, BOX_PREFIX, "box");
        double[] box = parseValues(boxText, Configuration.BOX_SIZE, "box header", policy);

        String energyText = headerValue(lines, 2, ENERGY_PREFIX, "energy");
        double[] energy = parseValues(energyText, Configuration.ENERGY_SIZE, "energy header", policy);

        int rows = lines.size() - HEADER_LINES;
        double[][] particles = new double[rows][];
        for (int i = 0; i < rows; i++) {
            String row = lines.get(HEADER_LINES + i).trim();
            particles[i] = parseValues(row, Configuration.PARTICLE_WIDTH, "particle row", policy);
        }
        return new Configuration(time, box, energy, particles);
    }

    private static String headerValue(List<String> lines, int index, String prefix, String kind) {
        if (index >= lines.size()) {
            throw new TrajectoryFormatException("Missing " + kind + " header line");
        }
        String line = lines.get(index);
        if (!line.startsWith(prefix)) {
            throw new TrajectoryFormatException(
                    "Line " + kind + " does not start with " + prefix + ": \"" + line + "\"");
        }
        int eq = line.indexOf('=');
        if (eq < 0 || !line.substring(prefix.length(), eq).isBlank()) {
            throw new TrajectoryFormatException("Invalid " + kind + " header format: \"" + line + "\"");
        }
        return line.substring(eq + 1).trim();
    }

    private static double[] parseValues(String text, int count, String kind, TokenizationPolicy policy) {
        String[] tokens = FloatTokens.split(text, policy);
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                values[i] = FloatTokens.parseDouble(tokens[i]);
            } catch (NumberFormatException e) {
                throw new TrajectoryFormatException("Invalid " + kind + " value \"" + text + "\"", e);
            }
        }
        if (values.length != count) {
            throw new TrajectoryFormatException("Invalid " + kind + " values, expected "
                    + count + " but got " + values.length + ": \"" + text + "\"");
        }
        return values;
    }

    /**
     * Encodes one configuration as its canonical block text. Every line,
     * including the last particle row, ends with {@code \n}.
     */
    public static String encode(Configuration configuration) {
        StringBuilder sb = new StringBuilder(estimateSize(configuration));
        sb.append(TIME_PREFIX).append(" = ").append(configuration.time()).append('\n');
        sb.append(BOX_PREFIX).append(" = ");
        FloatTokens.appendJoined(sb, configuration.box());
        sb.append('\n');
        sb.append(ENERGY_PREFIX).append(" = ");
        FloatTokens.appendJoined(sb, configuration.energy());
        sb.append('\n');
        for (double[] row : configuration.particles()) {
            FloatTokens.appendJoined(sb, row);
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Rough capacity hint for the encoded text of a configuration.
     */
    public static int estimateSize(Configuration configuration) {
        long size = 64L + (long) configuration.particleCount() * Configuration.PARTICLE_WIDTH * 12;
        return (int) Math.min(size, Integer.MAX_VALUE - 8);
    }
}
