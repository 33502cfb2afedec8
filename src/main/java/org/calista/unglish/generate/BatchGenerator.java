package org.calista.unglish.generate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.unglish.word.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates N words across a fixed worker pool.
 *
 * <p>With a seed in the options, word {@code i} is generated with {@code seed + i}, so a seeded batch equals
 * the same words generated one by one. Results come back in index order.</p>
 *
 * <p>Owns its pool unless one was supplied through the builder.</p>
 */
public final class BatchGenerator implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BatchGenerator.class);

    private final WordGenerator generator;
    private final ExecutorService pool;
    private final boolean ownsPool;
    private final boolean skipFailures;
    private final long shutdownTimeoutMs;
    private final int parallelism;

    private BatchGenerator(Builder b) {
        this.generator = Objects.requireNonNull(b.generator, "generator");
        this.parallelism = Math.max(1, b.parallelism);
        this.skipFailures = b.skipFailures;
        this.shutdownTimeoutMs = Math.max(0, b.shutdownTimeoutMs);
        if (b.pool != null) {
            this.pool = b.pool;
            this.ownsPool = false;
        } else {
            this.pool = createPool(parallelism, b.queueCapacity, b.threadNamePrefix);
            this.ownsPool = true;
        }
    }

    public static Builder builder(WordGenerator generator) {
        return new Builder(generator);
    }

    /**
     * @param count number of words, 0 gives an empty list
     * @throws IllegalArgumentException negative count
     * @throws CompletionException first failure, unless failures are skipped
     */
    public List<Word> generate(int count, GenerationOptions options) {
        if (count < 0) throw new IllegalArgumentException("batch size must be >= 0, got " + count);
        Objects.requireNonNull(options, "options");
        if (count == 0) return List.of();

        long started = System.nanoTime();
        List<CompletableFuture<Word>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            GenerationOptions wordOptions = options.seed == null ? options : options.withSeed(options.seed + i);
            futures.add(CompletableFuture.supplyAsync(() -> generator.generate(wordOptions), pool));
        }

        List<Word> out = new ArrayList<>(count);
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).join());
            } catch (CompletionException e) {
                if (!skipFailures) {
                    futures.forEach(f -> f.cancel(false));
                    throw e;
                }
                failed++;
                log.warn("batch word {} failed, skipped: {}", i, e.getCause() == null ? e.toString() : e.getCause().toString());
            }
        }

        if (log.isInfoEnabled()) {
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            log.info("batch finished: words={} failed={} elapsedMs={} threads={}", out.size(), failed, ms, parallelism);
        }
        return out;
    }

    public int parallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (ownsPool) {
            shutdownExecutor(pool, shutdownTimeoutMs);
        } else {
            log.debug("BatchGenerator.close(): pool is externally owned; skipping shutdown");
        }
    }

    private static ExecutorService createPool(int parallelism, int queueCapacity, String threadNamePrefix) {
        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy: the submitting thread generates when the queue is full
        return new ThreadPoolExecutor(
                parallelism,
                parallelism,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final WordGenerator generator;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int queueCapacity = 1024;
        private String threadNamePrefix = "unglish-batch-";
        private long shutdownTimeoutMs = 2000;
        private boolean skipFailures;
        private ExecutorService pool;

        private Builder(WordGenerator generator) {
            this.generator = generator;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
            return this;
        }

        /** Log and drop failed words instead of failing the whole batch. */
        public Builder skipFailures(boolean skipFailures) {
            this.skipFailures = skipFailures;
            return this;
        }

        /** Externally owned pool; not shut down by {@link BatchGenerator#close()}. */
        public Builder pool(ExecutorService pool) {
            this.pool = pool;
            return this;
        }

        public BatchGenerator build() {
            return new BatchGenerator(this);
        }
    }
}
