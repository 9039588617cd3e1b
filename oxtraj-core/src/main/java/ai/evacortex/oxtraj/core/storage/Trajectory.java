/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.storage;

import ai.evacortex.oxtraj.core.Configuration;
import ai.evacortex.oxtraj.core.LocatedConfiguration;
import ai.evacortex.oxtraj.core.TrajectoryCodec;
import ai.evacortex.oxtraj.core.engine.ParallelTrajectoryCodec;
import ai.evacortex.oxtraj.core.engine.TrajectoryOptions;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Random access to the configurations of one trajectory file.
 *
 * <p>Configurations are decoded in chunks of {@link TrajectoryOptions#chunkSize()}
 * blocks; decoded chunks are kept in a bounded cache. Block offsets learned while
 * decoding feed the {@link TrajectoryIndex}, so later lookups can seek directly.</p>
 */
public class Trajectory implements Iterable<Configuration>, Closeable {

    private final Path path;
    private final TrajectoryCodec codec;
    private final ParallelTrajectoryCodec ownedCodec;
    private final TrajectoryIndex index;
    private final int chunkSize;
    private final LoadingCache<Integer, List<Configuration>> chunks;

    public static Trajectory open(Path path) {
        return open(path, TrajectoryOptions.fromSystemProperties());
    }

    public static Trajectory open(Path path, TrajectoryOptions options) {
        ParallelTrajectoryCodec codec = new ParallelTrajectoryCodec(options);
        try {
            return new Trajectory(path, codec, options, true, true);
        } catch (RuntimeException e) {
            codec.close();
            throw e;
        }
    }

    /**
     * Uses a caller-managed codec; {@link #close()} does not close it.
     */
    public Trajectory(Path path, TrajectoryCodec codec, TrajectoryOptions options, boolean persistIndex) {
        this(path, codec, options, persistIndex, false);
    }

    private Trajectory(Path path, TrajectoryCodec codec, TrajectoryOptions options,
                       boolean persistIndex, boolean ownsCodec) {
        this.path = path;
        this.codec = codec;
        this.ownedCodec = ownsCodec ? (ParallelTrajectoryCodec) codec : null;
        this.chunkSize = options.chunkSize();
        this.index = TrajectoryIndex.open(path, codec, chunkSize, persistIndex);
        this.chunks = Caffeine.newBuilder()
                .maximumSize(options.cachedChunks())
                .build(this::loadChunk);
    }

    private List<Configuration> loadChunk(Integer chunk) {
        int first = chunk * chunkSize;
        long start = index.startOffset(first);
        List<LocatedConfiguration> located = codec.readConfigurations(path, start, chunkSize);

        List<Long> ends = new ArrayList<>(located.size());
        List<Configuration> confs = new ArrayList<>(located.size());
        for (LocatedConfiguration lc : located) {
            ends.add(lc.endOffset());
            confs.add(lc.configuration());
        }
        index.update(first, ends);
        return List.copyOf(confs);
    }

    /**
     * @throws IndexOutOfBoundsException if {@code i} is negative or past the last block
     */
    public Configuration get(int i) {
        if (i < 0) throw new IndexOutOfBoundsException("Negative configuration index: " + i);
        int chunk = i / chunkSize;
        List<Configuration> confs = chunks.get(chunk);
        int relative = i - chunk * chunkSize;
        if (relative >= confs.size()) {
            throw new IndexOutOfBoundsException("Configuration " + i + " is past the end of " + path);
        }
        return confs.get(relative);
    }

    /**
     * Number of configurations in the file. Scans the remaining block boundaries if needed.
     */
    public int length() {
        return index.size();
    }

    public void ensureIndex() {
        index.ensureComplete();
    }

    public TrajectoryIndex index() {
        return index;
    }

    public Path path() {
        return path;
    }

    @Override
    public Iterator<Configuration> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return index.contains(next);
            }

            @Override
            public Configuration next() {
                if (!hasNext()) throw new NoSuchElementException();
                return get(next++);
            }
        };
    }

    @Override
    public void close() {
        chunks.invalidateAll();
        chunks.cleanUp();
        if (ownedCodec != null) ownedCodec.close();
    }
}
