/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.storage;

import ai.evacortex.oxtraj.core.TrajectoryCodec;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryFormatException;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryReadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sparse, lazily grown index of block end offsets for one trajectory file.
 *
 * <p>The start offset of block {@code i} is {@code 0} for the first block and
 * the end offset of block {@code i - 1} otherwise. Unknown offsets are found by
 * scanning forward from the last known one in chunks.</p>
 *
 * <p>A complete index is persisted next to the trajectory as {@code <file>.idx},
 * a JSON array of {@code [startOffset, length, index]} triples. A sidecar whose
 * entries are not contiguous or do not end at the current file size is ignored
 * and rebuilt.</p>
 */
public class TrajectoryIndex {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryIndex.class);

    public static final String SIDECAR_SUFFIX = ".idx";

    private final Path trajectoryFile;
    private final Path indexFile;
    private final long fileSize;
    private final int chunkSize;
    private final TrajectoryCodec codec;
    private final boolean persistent;
    private final ObjectMapper mapper;
    private final List<Long> endOffsets = new ArrayList<>();

    private TrajectoryIndex(Path trajectoryFile, long fileSize, int chunkSize, TrajectoryCodec codec, boolean persistent) {
        this.trajectoryFile = trajectoryFile;
        this.indexFile = sidecarPath(trajectoryFile);
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
        this.codec = codec;
        this.persistent = persistent;
        this.mapper = new ObjectMapper();
    }

    public static TrajectoryIndex open(Path trajectoryFile, TrajectoryCodec codec, int chunkSize, boolean persistent) {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        long size;
        try {
            size = Files.size(trajectoryFile);
        } catch (IOException e) {
            throw new TrajectoryReadException(trajectoryFile, 0, e);
        }
        TrajectoryIndex idx = new TrajectoryIndex(trajectoryFile, size, chunkSize, codec, persistent);
        if (persistent) {
            idx.endOffsets.addAll(idx.loadSidecar());
        }
        return idx;
    }

    public static Path sidecarPath(Path trajectoryFile) {
        return trajectoryFile.resolveSibling(trajectoryFile.getFileName().toString() + SIDECAR_SUFFIX);
    }

    private List<Long> loadSidecar() {
        if (!Files.exists(indexFile)) return Collections.emptyList();
        long[][] entries;
        try (InputStream in = Files.newInputStream(indexFile)) {
            entries = mapper.readValue(in, long[][].class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable index {}: {}", indexFile, e.getMessage());
            return Collections.emptyList();
        }

        List<Long> loaded = new ArrayList<>(entries == null ? 0 : entries.length);
        if (entries != null) {
            for (int i = 0; i < entries.length; i++) {
                long[] e = entries[i];
                if (e == null || e.length != 3 || e[2] != i || e[1] < 0) {
                    loaded = null;
                    break;
                }
                long expectedStart = i == 0 ? 0 : loaded.get(i - 1);
                if (e[0] != expectedStart) {
                    loaded = null;
                    break;
                }
                loaded.add(e[0] + e[1]);
            }
        }
        if (loaded == null || loaded.isEmpty() || loaded.get(loaded.size() - 1) != fileSize) {
            log.warn("Ignoring stale index {} for {} ({} bytes)", indexFile, trajectoryFile, fileSize);
            return Collections.emptyList();
        }
        log.debug("Loaded {} block offsets from {}", loaded.size(), indexFile);
        return loaded;
    }

    private void saveSidecar() {
        long[][] entries = new long[endOffsets.size()][];
        long start = 0;
        for (int i = 0; i < entries.length; i++) {
            long end = endOffsets.get(i);
            entries[i] = new long[] {start, end - start, i};
            start = end;
        }
        try (OutputStream out = Files.newOutputStream(indexFile,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            mapper.writeValue(out, entries);
            log.debug("Saved {} block offsets to {}", entries.length, indexFile);
        } catch (IOException e) {
            log.warn("Failed to write index {}: {}", indexFile, e.getMessage());
        }
    }

    private boolean isPartial() {
        return fileSize > 0 && (endOffsets.isEmpty() || endOffsets.get(endOffsets.size() - 1) < fileSize);
    }

    /**
     * Start offset of block {@code index}, scanning further into the file when needed.
     *
     * @throws IndexOutOfBoundsException if the block lies beyond the end of the file
     */
    public synchronized long startOffset(int index) {
        if (index < 0) throw new IndexOutOfBoundsException("Negative block index: " + index);
        if (isPartial() && index > endOffsets.size()) {
            grow(index);
        }
        if (index == 0) return 0;
        if (index > endOffsets.size()) {
            throw new IndexOutOfBoundsException("Block " + index + " is past the end of " + trajectoryFile);
        }
        long offset = endOffsets.get(index - 1);
        if (offset >= fileSize) {
            throw new IndexOutOfBoundsException("Block " + index + " is past the end of " + trajectoryFile);
        }
        return offset;
    }

    /**
     * Whether block {@code index} exists, scanning further into the file when needed.
     */
    public synchronized boolean contains(int index) {
        if (index < 0) return false;
        while (index >= endOffsets.size() && isPartial()) {
            grow(index + 1);
        }
        return index < endOffsets.size();
    }

    /**
     * Merges end offsets learned elsewhere (e.g. by decoding a chunk) starting at block {@code firstIndex}.
     *
     * @throws IndexOutOfBoundsException if {@code firstIndex} would leave a gap
     */
    public synchronized void update(int firstIndex, List<Long> offsets) {
        if (firstIndex < 0) throw new IllegalArgumentException("Negative first index: " + firstIndex);
        if (firstIndex > endOffsets.size()) {
            throw new IndexOutOfBoundsException("first index " + firstIndex
                    + " is not contiguous with the " + endOffsets.size() + " known offsets");
        }
        if (endOffsets.size() >= firstIndex + offsets.size()) return;

        endOffsets.subList(firstIndex, endOffsets.size()).clear();
        endOffsets.addAll(offsets);
        if (persistent && !isPartial()) {
            saveSidecar();
        }
    }

    private void grow(int targetIndex) {
        int known = endOffsets.size();
        long from = known == 0 ? 0 : endOffsets.get(known - 1);
        List<Long> offsets = codec.readOffsets(trajectoryFile, from, Math.max(chunkSize, targetIndex - known));
        if (offsets.isEmpty()) {
            throw new TrajectoryFormatException("Failed to build index for \"" + trajectoryFile
                    + "\" from index=" + known + "-" + targetIndex);
        }
        update(known, offsets);
    }

    public synchronized void ensureComplete() {
        while (isPartial()) {
            grow(endOffsets.size() + chunkSize);
        }
    }

    /**
     * Number of blocks in the file; completes the index first.
     */
    public synchronized int size() {
        ensureComplete();
        return endOffsets.size();
    }

    public synchronized int knownSize() {
        return endOffsets.size();
    }

    public synchronized boolean isComplete() {
        return !isPartial();
    }

    public synchronized List<Long> endOffsets() {
        return List.copyOf(endOffsets);
    }

    public Path indexFile() {
        return indexFile;
    }

    public long fileSize() {
        return fileSize;
    }
}
