/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.exceptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * I/O failure while opening, seeking or reading a trajectory file.
 * Never retried; the call that hit it is aborted without a partial result.
 */
public class TrajectoryReadException extends RuntimeException {

    private final Path path;
    private final long offset;

    public TrajectoryReadException(Path path, long offset, IOException cause) {
        super("Failed to read trajectory " + path + " at offset " + offset + ": " + cause.getMessage(), cause);
        this.path = path;
        this.offset = offset;
    }

    public TrajectoryReadException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
        this.offset = -1;
    }

    public Path path() {
        return path;
    }

    public long offset() {
        return offset;
    }
}
