/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io.codec;

/**
 * How header values and particle rows are split into numeric tokens.
 */
public enum TokenizationPolicy {

    /**
     * Split on every single space. Repeated spaces yield empty tokens, which
     * fail to parse. Matches the files written by {@link ConfigurationCodec#encode}.
     */
    STRICT,

    /**
     * Split on runs of spaces and tabs.
     */
    WHITESPACE;

    public static TokenizationPolicy parse(String name) {
        return valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
