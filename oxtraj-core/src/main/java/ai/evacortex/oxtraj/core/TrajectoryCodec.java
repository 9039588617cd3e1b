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
import ai.evacortex.oxtraj.core.exceptions.TrajectoryFormatException;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryReadException;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code TrajectoryCodec} defines batch access to trajectory files made of
 * consecutive configuration blocks.
 *
 * <p>Offsets are zero-based byte positions in the file and are the only resume
 * mechanism: the end offset returned for a block is the start offset to pass
 * for the block after it. A start offset does not need to fall on a block
 * boundary; scanning skips forward to the next time header.</p>
 *
 * <p>Every call opens and owns its own file handle and keeps no state once it
 * returns, so implementations are safe to call from several threads.
 * Calls either succeed completely or throw; partial results are never returned.</p>
 *
 * @see Configuration
 * @see LocatedConfiguration
 */
public interface TrajectoryCodec {

    /**
     * Decodes at most {@code maxCount} configurations, scanning from {@code startOffset}.
     *
     * <p>The result is in file order regardless of how decoding was scheduled.
     * If several blocks are malformed, the failure of the earliest one is thrown.</p>
     *
     * @param path        trajectory file
     * @param startOffset byte offset to start scanning at
     * @param maxCount    maximum number of configurations to decode
     * @return {@code min(maxCount, remaining blocks)} configurations with their end offsets
     * @throws TrajectoryFormatException if a block is malformed
     * @throws TrajectoryReadException   if the file cannot be opened or read
     */
    List<LocatedConfiguration> readConfigurations(Path path, long startOffset, int maxCount);

    /**
     * Scans block boundaries only, without keeping or decoding block text.
     *
     * @param path        trajectory file
     * @param startOffset byte offset to start scanning at
     * @param maxCount    maximum number of blocks to index
     * @return strictly increasing block end offsets, in file order
     * @throws TrajectoryReadException if the file cannot be opened or read
     */
    List<Long> readOffsets(Path path, long startOffset, int maxCount);

    /**
     * Encodes configurations to their canonical block text, preserving input order.
     * The caller joins and writes the blocks.
     *
     * @param configurations configurations to encode
     * @return one block of text per configuration
     * @throws InvalidConfigurationException if the list contains {@code null}
     */
    List<String> dumpConfigurations(List<Configuration> configurations);
}
