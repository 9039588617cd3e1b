/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.engine;

import ai.evacortex.oxtraj.core.io.LineCursor;
import ai.evacortex.oxtraj.core.io.codec.TokenizationPolicy;

/**
 * Tuning knobs for trajectory decoding, encoding and random access.
 */
public record TrajectoryOptions(
        int parallelism,                  // worker threads for block decoding / encoding
        TokenizationPolicy tokenization,  // how numeric values are split
        int readBufferSize,               // line reader buffer, bytes
        int chunkSize,                    // configurations decoded per random-access chunk
        int cachedChunks                  // decoded chunks kept by a Trajectory
) {

    public static final int DEFAULT_CHUNK_SIZE = 20;
    public static final int DEFAULT_CACHED_CHUNKS = 8;

    public TrajectoryOptions {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        if (tokenization == null) throw new IllegalArgumentException("tokenization must not be null");
        if (readBufferSize <= 0) throw new IllegalArgumentException("readBufferSize must be positive: " + readBufferSize);
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        if (cachedChunks <= 0) throw new IllegalArgumentException("cachedChunks must be positive: " + cachedChunks);
    }

    public static TrajectoryOptions defaults() {
        return new TrajectoryOptions(
                Runtime.getRuntime().availableProcessors(),
                TokenizationPolicy.STRICT,
                LineCursor.DEFAULT_BUFFER_SIZE,
                DEFAULT_CHUNK_SIZE,
                DEFAULT_CACHED_CHUNKS);
    }

    /**
     * Defaults overridden by {@code oxtraj.*} system properties.
     */
    public static TrajectoryOptions fromSystemProperties() {
        TrajectoryOptions d = defaults();
        return new TrajectoryOptions(
                Integer.getInteger("oxtraj.parallelism", d.parallelism()),
                TokenizationPolicy.parse(System.getProperty("oxtraj.tokenization", d.tokenization().name())),
                Integer.getInteger("oxtraj.read.bufferSize", d.readBufferSize()),
                Integer.getInteger("oxtraj.chunkSize", d.chunkSize()),
                Integer.getInteger("oxtraj.cache.chunks", d.cachedChunks()));
    }

    public TrajectoryOptions withParallelism(int parallelism) {
        return new TrajectoryOptions(parallelism, tokenization, readBufferSize, chunkSize, cachedChunks);
    }

    public TrajectoryOptions withTokenization(TokenizationPolicy tokenization) {
        return new TrajectoryOptions(parallelism, tokenization, readBufferSize, chunkSize, cachedChunks);
    }

    public TrajectoryOptions withReadBufferSize(int readBufferSize) {
        return new TrajectoryOptions(parallelism, tokenization, readBufferSize, chunkSize, cachedChunks);
    }

    public TrajectoryOptions withChunking(int chunkSize, int cachedChunks) {
        return new TrajectoryOptions(parallelism, tokenization, readBufferSize, chunkSize, cachedChunks);
    }
}
