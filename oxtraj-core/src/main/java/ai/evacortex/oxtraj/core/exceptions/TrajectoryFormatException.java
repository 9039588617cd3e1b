/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.exceptions;

/**
 * Raised when the text of a configuration block does not follow the trajectory
 * format: a missing or mis-prefixed header, a wrong value count, an unparsable
 * number or a particle row of the wrong length.
 *
 * <p>The message always quotes the offending raw text. When the failure comes
 * from a batch call, {@link #blockIndex()} is the zero-based position of the
 * failing block inside that batch, otherwise {@code -1}.</p>
 */
public class TrajectoryFormatException extends RuntimeException {

    private final int blockIndex;

    public TrajectoryFormatException(String message) {
        super(message);
        this.blockIndex = -1;
    }

    public TrajectoryFormatException(String message, Throwable cause) {
        super(message, cause);
        this.blockIndex = -1;
    }

    private TrajectoryFormatException(String message, Throwable cause, int blockIndex) {
        super(message, cause);
        this.blockIndex = blockIndex;
    }

    /**
     * Returns a copy of this failure tagged with the block position it occurred at.
     */
    public TrajectoryFormatException atBlock(int index) {
        return new TrajectoryFormatException("Block " + index + ": " + getMessage(), this, index);
    }

    public int blockIndex() {
        return blockIndex;
    }
}
