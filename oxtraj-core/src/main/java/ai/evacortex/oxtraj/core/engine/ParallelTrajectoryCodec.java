/*
 * OxTraj — Trajectory Block Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.oxtraj.core.engine;

import ai.evacortex.oxtraj.core.Configuration;
import ai.evacortex.oxtraj.core.LocatedConfiguration;
import ai.evacortex.oxtraj.core.TrajectoryCodec;
import ai.evacortex.oxtraj.core.exceptions.InvalidConfigurationException;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryFormatException;
import ai.evacortex.oxtraj.core.exceptions.TrajectoryReadException;
import ai.evacortex.oxtraj.core.io.BlockScanner;
import ai.evacortex.oxtraj.core.io.ScannedBlock;
import ai.evacortex.oxtraj.core.io.codec.ConfigurationCodec;
import ai.evacortex.oxtraj.core.io.codec.TokenizationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.TimeUnit;

/**
 * {@link TrajectoryCodec} that scans blocks sequentially and decodes / encodes
 * them on a fork-join pool.
 *
 * <p>Boundary discovery is a single-threaded producer: block N+1 cannot be found
 * before the bytes of block N are consumed. Each extracted block is tagged with
 * its sequence index and decoded by a worker; results are sorted back by index
 * once every submitted block has finished.</p>
 */
public class ParallelTrajectoryCodec implements TrajectoryCodec, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ParallelTrajectoryCodec.class);

    private static final int ENCODE_THRESHOLD = 4;

    private final TrajectoryOptions options;
    private final ForkJoinPool pool;
    private final boolean ownsPool;

    public ParallelTrajectoryCodec() {
        this(TrajectoryOptions.fromSystemProperties());
    }

    public ParallelTrajectoryCodec(TrajectoryOptions options) {
        this(options, new ForkJoinPool(options.parallelism()), true);
    }

    /**
     * Uses a caller-managed pool; {@link #close()} leaves it running.
     */
    public ParallelTrajectoryCodec(TrajectoryOptions options, ForkJoinPool pool) {
        this(options, pool, false);
    }

    private ParallelTrajectoryCodec(TrajectoryOptions options, ForkJoinPool pool, boolean ownsPool) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.ownsPool = ownsPool;
    }

    record DecodeResult(int index, long endOffset, Configuration configuration, RuntimeException failure) {

        static DecodeResult decoded(int index, long endOffset, Configuration configuration) {
            return new DecodeResult(index, endOffset, configuration, null);
        }

        static DecodeResult failed(int index, RuntimeException failure) {
            return new DecodeResult(index, -1, null, failure);
        }
    }

    @Override
    public List<LocatedConfiguration> readConfigurations(Path path, long startOffset, int maxCount) {
        checkRange(startOffset, maxCount);
        long started = System.nanoTime();

        CompletionService<DecodeResult> completion = new ExecutorCompletionService<>(pool);
        TokenizationPolicy policy = options.tokenization();
        int submitted = 0;
        DecodeResult scanFailure = null;

        try (BlockScanner scanner = BlockScanner.open(path, startOffset, true, options.readBufferSize())) {
            while (submitted < maxCount) {
                ScannedBlock block;
                try {
                    if (!scanner.hasNext()) break;
                    block = scanner.next();
                } catch (TrajectoryReadException e) {
                    scanFailure = DecodeResult.failed(submitted, e);
                    break;
                }
                final int index = submitted++;
                final ScannedBlock extracted = block;
                completion.submit(() -> decodeBlock(index, extracted, policy));
            }
        } catch (IOException e) {
            throw new TrajectoryReadException(path, startOffset, e);
        }

        List<DecodeResult> results = new ArrayList<>(submitted + 1);
        for (int i = 0; i < submitted; i++) {
            results.add(awaitNext(completion, path));
        }
        if (scanFailure != null) results.add(scanFailure);

        List<LocatedConfiguration> ordered = collect(results);
        if (log.isDebugEnabled()) {
            log.debug("Decoded {} configurations from {} starting at {} in {} ms",
                    ordered.size(), path, startOffset, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        }
        return ordered;
    }

    private static DecodeResult decodeBlock(int index, ScannedBlock block, TokenizationPolicy policy) {
        try {
            Configuration conf = ConfigurationCodec.decode(block.lines(), policy);
            return DecodeResult.decoded(index, block.endOffset(), conf);
        } catch (TrajectoryFormatException e) {
            return DecodeResult.failed(index, e.atBlock(index));
        } catch (RuntimeException e) {
            return DecodeResult.failed(index, e);
        }
    }

    private static DecodeResult awaitNext(CompletionService<DecodeResult> completion, Path path) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrajectoryReadException("Interrupted while decoding " + path, e);
        } catch (ExecutionException e) {
            throw new TrajectoryReadException("Decoding task failed for " + path, e.getCause());
        }
    }

    /**
     * Restores discovery order and fails with the lowest-index failure, if any.
     */
    static List<LocatedConfiguration> collect(List<DecodeResult> results) {
        List<DecodeResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingInt(DecodeResult::index));

        List<LocatedConfiguration> out = new ArrayList<>(sorted.size());
        for (DecodeResult r : sorted) {
            if (r.failure() != null) throw r.failure();
            out.add(new LocatedConfiguration(r.endOffset(), r.configuration()));
        }
        return out;
    }

    @Override
    public List<Long> readOffsets(Path path, long startOffset, int maxCount) {
        checkRange(startOffset, maxCount);
        List<Long> offsets = new ArrayList<>();
        try (BlockScanner scanner = BlockScanner.open(path, startOffset, false, options.readBufferSize())) {
            while (offsets.size() < maxCount && scanner.hasNext()) {
                offsets.add(scanner.next().endOffset());
            }
        } catch (IOException e) {
            throw new TrajectoryReadException(path, startOffset, e);
        }
        log.debug("Indexed {} blocks of {} starting at {}", offsets.size(), path, startOffset);
        return offsets;
    }

    @Override
    public List<String> dumpConfigurations(List<Configuration> configurations) {
        Objects.requireNonNull(configurations, "configurations must not be null");
        for (int i = 0; i < configurations.size(); i++) {
            if (configurations.get(i) == null) {
                throw new InvalidConfigurationException("null configuration at index " + i);
            }
        }
        String[] encoded = new String[configurations.size()];
        if (encoded.length > 0) {
            pool.invoke(new EncodeTask(configurations, encoded, 0, encoded.length));
        }
        return List.of(encoded);
    }

    private static final class EncodeTask extends RecursiveAction {
        private final List<Configuration> source;
        private final String[] target;
        private final int from;
        private final int to;

        EncodeTask(List<Configuration> source, String[] target, int from, int to) {
            this.source = source;
            this.target = target;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from <= ENCODE_THRESHOLD) {
                for (int i = from; i < to; i++) {
                    target[i] = ConfigurationCodec.encode(source.get(i));
                }
            } else {
                int mid = (from + to) >>> 1;
                invokeAll(new EncodeTask(source, target, from, mid),
                          new EncodeTask(source, target, mid, to));
            }
        }
    }

    private static void checkRange(long startOffset, int maxCount) {
        if (startOffset < 0) throw new IllegalArgumentException("Negative start offset: " + startOffset);
        if (maxCount < 0) throw new IllegalArgumentException("Negative max count: " + maxCount);
    }

    public TrajectoryOptions options() {
        return options;
    }

    @Override
    public void close() {
        if (!ownsPool) return;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) pool.shutdownNow();
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
