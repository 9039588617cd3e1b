/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io;

import java.util.List;

/**
 * Boundaries of one configuration block and, when retained, its raw lines
 * (header lines first). {@code endOffset} is where the next block's time
 * header starts, or the end of the file.
 */
public record ScannedBlock(long startOffset, long endOffset, List<String> lines) {

    public long length() {
        return endOffset - startOffset;
    }
}
