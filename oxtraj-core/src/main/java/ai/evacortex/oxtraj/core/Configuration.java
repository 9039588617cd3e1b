/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core;

import ai.evacortex.oxtraj.core.exceptions.InvalidConfigurationException;

import java.util.Arrays;

/**
 * One trajectory snapshot: a time step, the simulation box, three energy
 * components and one 15-value row per particle.
 *
 * <p>Numeric payload is opaque to this library. Arrays are stored as given,
 * without copying. Equality compares array contents bit-wise
 * ({@code -0.0 != 0.0}, {@code NaN == NaN}).</p>
 */
public record Configuration(long time, double[] box, double[] energy, double[][] particles) {

    public static final int BOX_SIZE = 3;
    public static final int ENERGY_SIZE = 3;
    public static final int PARTICLE_WIDTH = 15;

    public Configuration {
        if (time < 0) {
            throw new InvalidConfigurationException("time must be non-negative, got " + time);
        }
        if (box == null || box.length != BOX_SIZE) {
            throw new InvalidConfigurationException("box must hold " + BOX_SIZE + " values");
        }
        if (energy == null || energy.length != ENERGY_SIZE) {
            throw new InvalidConfigurationException("energy must hold " + ENERGY_SIZE + " values");
        }
        if (particles == null) {
            throw new InvalidConfigurationException("particles must not be null");
        }
        for (int i = 0; i < particles.length; i++) {
            if (particles[i] == null || particles[i].length != PARTICLE_WIDTH) {
                throw new InvalidConfigurationException("particle row " + i + " must hold " + PARTICLE_WIDTH + " values");
            }
        }
    }

    public int particleCount() {
        return particles.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration other)) return false;
        return time == other.time
                && Arrays.equals(box, other.box)
                && Arrays.equals(energy, other.energy)
                && Arrays.deepEquals(particles, other.particles);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(time);
        result = 31 * result + Arrays.hashCode(box);
        result = 31 * result + Arrays.hashCode(energy);
        result = 31 * result + Arrays.deepHashCode(particles);
        return result;
    }

    @Override
    public String toString() {
        return "Configuration[time=" + time + ", particles=" + particles.length + "]";
    }
}
