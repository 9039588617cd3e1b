/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Buffered, forward-only line reader over a trajectory file that keeps exact
 * byte offsets.
 *
 * <p>Each {@link #advance()} reads one line and records the offset it started
 * at. End of file is a zero-length read and is not an error. An I/O failure
 * marks the cursor as failed and exhausted; no read is attempted afterwards.</p>
 *
 * <p>Line text excludes the terminating {@code \n} (and a preceding {@code \r})
 * and is decoded as UTF-8 only when {@link #line()} is called.</p>
 */
public final class LineCursor implements Closeable {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final FileChannel channel;
    private final ByteBuffer chunk;

    private byte[] lineBytes = new byte[256];
    private int lineLength;
    private String lineText = "";

    private long position;
    private long lineStart;
    private int bytesRead;
    private boolean reachedEnd;
    private boolean failed;

    private LineCursor(Path path, FileChannel channel, long offset, int bufferSize) {
        this.path = path;
        this.channel = channel;
        this.chunk = ByteBuffer.allocate(bufferSize);
        this.chunk.flip();
        this.position = offset;
        this.lineStart = offset;
    }

    public static LineCursor open(Path path, long offset) throws IOException {
        return open(path, offset, DEFAULT_BUFFER_SIZE);
    }

    public static LineCursor open(Path path, long offset, int bufferSize) throws IOException {
        if (offset < 0) throw new IllegalArgumentException("Negative offset: " + offset);
        if (bufferSize <= 0) throw new IllegalArgumentException("Invalid buffer size: " + bufferSize);
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            channel.position(offset);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new LineCursor(path, channel, offset, bufferSize);
    }

    /**
     * Reads the next line.
     *
     * @return {@code false} once end of file is reached or the cursor has failed
     * @throws IOException the underlying read failed; the cursor is exhausted afterwards
     */
    public boolean advance() throws IOException {
        lineLength = 0;
        lineText = null;
        lineStart = position;
        bytesRead = 0;
        if (reachedEnd) {
            lineText = "";
            return false;
        }
        try {
            bytesRead = readLine();
        } catch (IOException e) {
            failed = true;
            reachedEnd = true;
            lineText = "";
            throw e;
        }
        position += bytesRead;
        if (bytesRead == 0) {
            reachedEnd = true;
            lineText = "";
            return false;
        }
        return true;
    }

    private int readLine() throws IOException {
        int consumed = 0;
        while (true) {
            if (!chunk.hasRemaining()) {
                chunk.clear();
                int n = channel.read(chunk);
                chunk.flip();
                if (n <= 0) {
                    return consumed;
                }
            }
            byte[] data = chunk.array();
            int from = chunk.position();
            int to = chunk.limit();
            int i = from;
            while (i < to && data[i] != '\n') i++;
            boolean terminated = i < to;
            int copyEnd = terminated ? i + 1 : to;
            append(data, from, copyEnd - from);
            consumed += copyEnd - from;
            chunk.position(copyEnd);
            if (terminated) {
                return consumed;
            }
        }
    }

    private void append(byte[] src, int from, int len) {
        if (lineLength + len > lineBytes.length) {
            lineBytes = Arrays.copyOf(lineBytes, Math.max(lineBytes.length * 2, lineLength + len));
        }
        System.arraycopy(src, from, lineBytes, lineLength, len);
        lineLength += len;
    }

    /**
     * Whether the current line begins with the given ASCII character,
     * checked on raw bytes without decoding the line.
     */
    public boolean lineStartsWith(char c) {
        return lineLength > 0 && lineBytes[0] == (byte) c;
    }

    public String line() {
        if (lineText == null) {
            int end = lineLength;
            if (end > 0 && lineBytes[end - 1] == '\n') end--;
            if (end > 0 && lineBytes[end - 1] == '\r') end--;
            lineText = new String(lineBytes, 0, end, StandardCharsets.UTF_8);
        }
        return lineText;
    }

    /** Offset of the first byte of the current line; the end position once exhausted. */
    public long lineStart() {
        return lineStart;
    }

    /** Offset right after the bytes consumed so far. */
    public long position() {
        return position;
    }

    /** Raw length of the current line including its terminator. */
    public int bytesRead() {
        return bytesRead;
    }

    public boolean reachedEnd() {
        return reachedEnd;
    }

    public boolean failed() {
        return failed;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
