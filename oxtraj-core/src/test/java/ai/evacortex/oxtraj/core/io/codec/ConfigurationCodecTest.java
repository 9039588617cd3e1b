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
import ai.evacortex.oxtraj.core.ConfigurationTestUtils;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryFormatException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationCodecTest {

    private static final String ZERO_ROW = "0 0 0 0 0 0 0 0 0 0 0 0 0 0 0";
    private static final String SHORT_ROW = "1 2 3 4 5 6 7 8 9 10 11 12 13 14";

    private static List<String> block(String... lines) {
        return List.of(lines);
    }

    private static TrajectoryFormatException decodeFails(List<String> lines) {
        return assertThrows(TrajectoryFormatException.class, () -> ConfigurationCodec.decode(lines));
    }

    @Test
    public void testDecodeBlock() {
        Configuration conf = ConfigurationCodec.decode(
                block("t = 0", "b = 10.0 10.0 10.0", "E = 1.0 2.0 3.0", ZERO_ROW));

        assertEquals(0, conf.time());
        assertArrayEquals(new double[] {10.0, 10.0, 10.0}, conf.box());
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, conf.energy());
        assertEquals(1, conf.particleCount());
        assertArrayEquals(new double[15], conf.particles()[0]);
    }

    @Test
    public void testDecodeBlockWithoutParticles() {
        Configuration conf = ConfigurationCodec.decode(block("t = 42", "b = 1 2 3", "E = -1 -2 -3"));
        assertEquals(42, conf.time());
        assertEquals(0, conf.particleCount());
    }

    @Test
    public void testRowsAreTrimmed() {
        Configuration conf = ConfigurationCodec.decode(
                block("t = 0", "b = 1 1 1", "E = 0 0 0", "  " + ZERO_ROW + " \t"));
        assertEquals(1, conf.particleCount());
    }

    @Test
    public void testMissingTimeHeader() {
        TrajectoryFormatException e = decodeFails(block());
        assertTrue(e.getMessage().contains("time"), e.getMessage());
    }

    @Test
    public void testWrongTimePrefix() {
        TrajectoryFormatException e = decodeFails(block("x = 0", "b = 1 1 1", "E = 0 0 0"));
        assertTrue(e.getMessage().contains("time"), e.getMessage());
        assertTrue(e.getMessage().contains("x = 0"), e.getMessage());
    }

    @Test
    public void testMalformedTimeHeader() {
        TrajectoryFormatException noEquals = decodeFails(block("t 0", "b = 1 1 1", "E = 0 0 0"));
        assertTrue(noEquals.getMessage().contains("t 0"), noEquals.getMessage());

        TrajectoryFormatException longPrefix = decodeFails(block("tx = 0", "b = 1 1 1", "E = 0 0 0"));
        assertTrue(longPrefix.getMessage().contains("tx = 0"), longPrefix.getMessage());
    }

    @Test
    public void testInvalidTimeValue() {
        TrajectoryFormatException text = decodeFails(block("t = abc", "b = 1 1 1", "E = 0 0 0"));
        assertTrue(text.getMessage().contains("\"abc\""), text.getMessage());

        TrajectoryFormatException negative = decodeFails(block("t = -1", "b = 1 1 1", "E = 0 0 0"));
        assertTrue(negative.getMessage().contains("-1"), negative.getMessage());

        decodeFails(block("t = 1.5", "b = 1 1 1", "E = 0 0 0"));
    }

    @Test
    public void testBoxHeaderErrors() {
        TrajectoryFormatException missing = decodeFails(block("t = 0"));
        assertTrue(missing.getMessage().contains("box"), missing.getMessage());

        TrajectoryFormatException prefix = decodeFails(block("t = 0", "E = 1 1 1", "E = 0 0 0"));
        assertTrue(prefix.getMessage().contains("box"), prefix.getMessage());

        TrajectoryFormatException count = decodeFails(block("t = 0", "b = 1 2", "E = 0 0 0"));
        assertTrue(count.getMessage().contains("box"), count.getMessage());
        assertTrue(count.getMessage().contains("1 2"), count.getMessage());

        TrajectoryFormatException value = decodeFails(block("t = 0", "b = 1 2 x", "E = 0 0 0"));
        assertTrue(value.getMessage().contains("1 2 x"), value.getMessage());
    }

    @Test
    public void testMissingEnergyHeader() {
        TrajectoryFormatException absent = decodeFails(block("t = 0", "b = 1 1 1"));
        assertTrue(absent.getMessage().contains("energy"), absent.getMessage());

        TrajectoryFormatException replaced = decodeFails(block("t = 0", "b = 1 1 1", ZERO_ROW));
        assertTrue(replaced.getMessage().contains("energy"), replaced.getMessage());
    }

    @Test
    public void testEnergyValueCount() {
        TrajectoryFormatException e = decodeFails(block("t = 0", "b = 1 1 1", "E = 1 2 3 4"));
        assertTrue(e.getMessage().contains("energy"), e.getMessage());
        assertTrue(e.getMessage().contains("1 2 3 4"), e.getMessage());
    }

    @Test
    public void testShortParticleRowFailsWholeBlock() {
        TrajectoryFormatException e = decodeFails(
                block("t = 0", "b = 1 1 1", "E = 0 0 0", ZERO_ROW, SHORT_ROW, ZERO_ROW));
        assertTrue(e.getMessage().contains(SHORT_ROW), e.getMessage());
    }

    @Test
    public void testUnparsableParticleValue() {
        String row = ZERO_ROW.replaceFirst("0", "zero");
        TrajectoryFormatException e = decodeFails(block("t = 0", "b = 1 1 1", "E = 0 0 0", row));
        assertTrue(e.getMessage().contains(row), e.getMessage());
    }

    @Test
    public void testRepeatedSpacesDependOnPolicy() {
        List<String> lines = block("t = 0", "b = 1  1 1", "E = 0 0 0", ZERO_ROW.replace(" ", "  "));

        assertThrows(TrajectoryFormatException.class, () -> ConfigurationCodec.decode(lines, TokenizationPolicy.STRICT));

        Configuration conf = ConfigurationCodec.decode(lines, TokenizationPolicy.WHITESPACE);
        assertArrayEquals(new double[] {1, 1, 1}, conf.box());
        assertEquals(1, conf.particleCount());
    }

    @Test
    public void testEncodeCanonicalText() {
        double[][] rows = {new double[15]};
        Configuration conf = new Configuration(0, new double[] {10, 10, 10}, new double[] {1.0, 2.0, 3.0}, rows);

        assertEquals("t = 0\nb = 10 10 10\nE = 1 2 3\n" + ZERO_ROW + "\n", ConfigurationCodec.encode(conf));
    }

    @Test
    public void testEncodeWithoutParticles() {
        Configuration conf = new Configuration(7, new double[] {1.5, 2.5, 3.5}, new double[] {0, 0, 0}, new double[0][]);
        assertEquals("t = 7\nb = 1.5 2.5 3.5\nE = 0 0 0\n", ConfigurationCodec.encode(conf));
    }

    @Test
    public void testRoundTripIsExact() {
        List<Configuration> confs = new ArrayList<>(ConfigurationTestUtils.createRandomTrajectory(5, 12, 77L));

        double[] special = {-0.0, 0.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY,
                1e-7, 1e300, Double.MIN_VALUE, -123.456, 0.1, 1.0 / 3, 5e-324 * 3, 123456789.125, -1, 2};
        confs.add(new Configuration(Long.MAX_VALUE, new double[] {0.1, 0.2, 0.3},
                new double[] {-0.0, Double.NaN, 1e-7}, new double[][] {special}));

        for (Configuration original : confs) {
            String text = ConfigurationCodec.encode(original);
            Configuration restored = ConfigurationCodec.decode(ConfigurationTestUtils.lines(text));
            assertEquals(original, restored, "round trip of " + original);
        }
    }
}
