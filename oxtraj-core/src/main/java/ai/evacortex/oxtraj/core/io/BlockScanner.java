/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io;

import ai.evacortex.oxtraj.core.exceptions.TrajectoryReadException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass iterator over the configuration blocks of a trajectory file.
 *
 * <p>A block starts at a line beginning with the time marker {@code t} and runs
 * up to the next such line or the end of the file. The next marker line is
 * looked at but not consumed: it opens the following block. Lines before the
 * first marker are skipped, so scanning may start at any byte offset.</p>
 *
 * <p>With line retention off only offsets are produced and no block text is
 * kept, which bounds memory independently of block size.</p>
 *
 * <p>An I/O failure is thrown as {@link TrajectoryReadException} from
 * {@link #hasNext()} / {@link #next()} and ends the iteration.</p>
 */
public final class BlockScanner implements Iterator<ScannedBlock>, Closeable {

    public static final char TIME_MARKER = 't';

    private final LineCursor cursor;
    private final boolean retainLines;

    private ScannedBlock pending;
    private boolean done;

    public BlockScanner(LineCursor cursor, boolean retainLines) {
        this.cursor = cursor;
        this.retainLines = retainLines;
    }

    public static BlockScanner open(Path path, long offset, boolean retainLines) {
        return open(path, offset, retainLines, LineCursor.DEFAULT_BUFFER_SIZE);
    }

    public static BlockScanner open(Path path, long offset, boolean retainLines, int bufferSize) {
        try {
            return new BlockScanner(LineCursor.open(path, offset, bufferSize), retainLines);
        } catch (IOException e) {
            throw new TrajectoryReadException(path, offset, e);
        }
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !done) {
            try {
                pending = scan();
            } catch (IOException e) {
                done = true;
                throw new TrajectoryReadException(cursor.path(), cursor.lineStart(), e);
            }
            if (pending == null) done = true;
        }
        return pending != null;
    }

    @Override
    public ScannedBlock next() {
        if (!hasNext()) throw new NoSuchElementException();
        ScannedBlock block = pending;
        pending = null;
        return block;
    }

    private ScannedBlock scan() throws IOException {
        if (cursor.reachedEnd()) return null;

        while (!cursor.lineStartsWith(TIME_MARKER)) {
            if (!cursor.advance()) return null;
        }

        long start = cursor.lineStart();
        List<String> lines = retainLines ? new ArrayList<>() : Collections.emptyList();
        if (retainLines) lines.add(cursor.line());

        cursor.advance();
        while (!cursor.reachedEnd() && !cursor.lineStartsWith(TIME_MARKER)) {
            if (retainLines) lines.add(cursor.line());
            cursor.advance();
        }
        // cursor now sits on the next marker line (kept for the next call) or at EOF
        return new ScannedBlock(start, cursor.lineStart(), lines);
    }

    @Override
    public void close() throws IOException {
        cursor.close();
    }
}
