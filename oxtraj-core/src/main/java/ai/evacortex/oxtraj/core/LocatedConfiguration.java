/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core;

/**
 * A decoded configuration together with the byte offset where its block ends.
 * The end offset is the resume point for the next block.
 */
public record LocatedConfiguration(long endOffset, Configuration configuration) {}
