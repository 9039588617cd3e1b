/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core;

import ai.evacortex.oxtraj.core.io.codec.ConfigurationCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;


/**
 * Utility class for creating synthetic {@link Configuration}s and trajectory files for testing.
 */
public class ConfigurationTestUtils {

    /**
     * Two-block trajectory with one particle per block.
     */
    public static final String TWO_BLOCK_FILE =
            "t = 0\n" +
            "b = 10.0 10.0 10.0\n" +
            "E = 1.0 2.0 3.0\n" +
            "0 0 0 0 0 0 0 0 0 0 0 0 0 0 0\n" +
            "t = 1\n" +
            "b = 10.0 10.0 10.0\n" +
            "E = 1.1 2.1 3.1\n" +
            "1 1 1 1 1 1 1 1 1 1 1 1 1 1 1\n";

    /** Byte offset of the second block's time header in {@link #TWO_BLOCK_FILE}. */
    public static final long TWO_BLOCK_SECOND_START = TWO_BLOCK_FILE.indexOf("t = 1");

    public static final long TWO_BLOCK_LENGTH = TWO_BLOCK_FILE.getBytes(StandardCharsets.UTF_8).length;

    public static Path write(Path file, String content) throws IOException {
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * Creates a Configuration whose particle values are all {@code value}.
     */
    public static Configuration createConstantConfiguration(long time, double value, int particles) {
        double[][] rows = new double[particles][Configuration.PARTICLE_WIDTH];
        for (double[] row : rows) Arrays.fill(row, value);
        return new Configuration(time, new double[] {value, value, value}, new double[] {value, -value, 0.5}, rows);
    }

    /**
     * Creates a Configuration with randomized box, energy and particle values.
     */
    public static Configuration createRandomConfiguration(long time, int particles, long seed) {
        Random random = new Random(seed);
        double[] box = {random.nextDouble() * 100, random.nextDouble() * 100, random.nextDouble() * 100};
        double[] energy = {random.nextGaussian(), random.nextGaussian(), random.nextGaussian()};
        double[][] rows = new double[particles][Configuration.PARTICLE_WIDTH];
        for (double[] row : rows) {
            for (int i = 0; i < row.length; i++) row[i] = random.nextGaussian() * 10;
        }
        return new Configuration(time, box, energy, rows);
    }

    public static List<Configuration> createRandomTrajectory(int count, int particles, long seed) {
        List<Configuration> confs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            confs.add(createRandomConfiguration(i * 1000L, particles, seed + i));
        }
        return confs;
    }

    /**
     * Writes the configurations as consecutive blocks.
     *
     * @return start offset of every block
     */
    public static List<Long> writeTrajectory(Path file, List<Configuration> confs) throws IOException {
        List<Long> starts = new ArrayList<>(confs.size());
        StringBuilder sb = new StringBuilder();
        long offset = 0;
        for (Configuration c : confs) {
            starts.add(offset);
            String block = ConfigurationCodec.encode(c);
            sb.append(block);
            offset += block.getBytes(StandardCharsets.UTF_8).length;
        }
        write(file, sb.toString());
        return starts;
    }

    public static List<String> lines(String blockText) {
        return List.of(blockText.split("\n"));
    }
}
