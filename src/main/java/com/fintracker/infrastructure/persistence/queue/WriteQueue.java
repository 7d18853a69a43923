package com.fintracker.infrastructure.persistence.queue;

import com.fintracker.config.AppProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serializes every database write of the application.
 *
 * Operations run one at a time, in the order they were enqueued, on a single writer
 * thread. The queue is a {@link CompletableFuture} chain: each new operation is attached
 * to the tail, and the tail is replaced by a link that absorbs the operation's failure,
 * so a failed write is reported to its own caller without stalling the writes behind it.
 *
 * Lock contention (SQLITE_BUSY / SQLITE_LOCKED) is retried with exponential backoff
 * (50ms, 100ms, 200ms by default). The backoff timer runs on the writer thread, so the
 * next operation in line waits until the retried one has settled. Any other failure, and
 * lock contention that outlives the retries, completes the returned future exceptionally
 * with the original error.
 *
 * Read-only queries do not go through the queue.
 */
@Slf4j
public class WriteQueue implements AutoCloseable {

    public static final String RETRY_NAME = "writeQueue";

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private static final String DEFAULT_OPERATION_NAME = "write";

    private final AppProperties.WriteQueue settings;
    private final MeterRegistry meterRegistry;
    private final Retry retry;
    private final ScheduledExecutorService executor;

    private final Object chainLock = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    private final AtomicInteger currentDepth = new AtomicInteger();
    private final AtomicInteger maxDepth = new AtomicInteger();

    private volatile String runningOperation;
    private volatile boolean closed;

    private final Counter queuedCounter;
    private final Counter successCounter;
    private final Counter retryAttemptCounter;
    private final Counter retrySuccessCounter;
    private final Counter retryExhaustedCounter;
    private final Timer durationTimer;

    public WriteQueue(AppProperties.WriteQueue settings, RetryRegistry retryRegistry, MeterRegistry meterRegistry) {
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        // a registry hands out one Retry per name; each queue needs its own config and listeners
        this.retry = retryRegistry.retry(retryName(INSTANCES.incrementAndGet()), retryConfig(settings));
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "write-queue");
            thread.setDaemon(true);
            return thread;
        });

        this.queuedCounter = Counter.builder("db.write.queued").register(meterRegistry);
        this.successCounter = Counter.builder("db.write.success").register(meterRegistry);
        this.retryAttemptCounter = Counter.builder("db.write.retry.attempt").register(meterRegistry);
        this.retrySuccessCounter = Counter.builder("db.write.retry.success").register(meterRegistry);
        this.retryExhaustedCounter = Counter.builder("db.write.retry.exhausted").register(meterRegistry);
        this.durationTimer = Timer.builder("db.write.duration").register(meterRegistry);
        Gauge.builder("db.write.queue.depth", currentDepth, AtomicInteger::get).register(meterRegistry);
        Gauge.builder("db.write.queue.max.depth", maxDepth, AtomicInteger::get).register(meterRegistry);

        registerRetryListeners();
    }

    static String retryName(int instance) {
        return instance == 1 ? RETRY_NAME : RETRY_NAME + "-" + instance;
    }

    String getRetryName() {
        return retry.getName();
    }

    static RetryConfig retryConfig(AppProperties.WriteQueue settings) {
        return RetryConfig.custom()
                .maxAttempts(settings.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff(), settings.getBackoffMultiplier()))
                .retryOnException(DatabaseErrorClassifier::isLockContention)
                .build();
    }

    /**
     * Append a write to the end of the queue.
     *
     * Never throws: every outcome, including a closed queue, is delivered through the
     * returned future.
     *
     * @param operation     database work, executed on the writer thread
     * @param operationName name used in logs, may be null
     * @return future completing with the operation's own result or failure
     */
    public <T> CompletableFuture<T> enqueueWrite(WriteOperation<T> operation, String operationName) {
        String name = operationName != null ? operationName : DEFAULT_OPERATION_NAME;

        if (closed) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Write queue is closed, rejected \"" + name + "\""));
        }

        long enqueuedAt = System.nanoTime();
        int depth = currentDepth.incrementAndGet();
        maxDepth.accumulateAndGet(depth, Math::max);

        if (depth > settings.getDepthWarningThreshold()) {
            log.warn("Write queue depth is {}, may indicate contention", depth);
        }

        CompletableFuture<T> result;
        synchronized (chainLock) {
            result = tail.thenComposeAsync(ignored -> execute(name, operation, enqueuedAt), executor);
            // the tail never fails, so one rejected write cannot break the chain
            tail = result.handle((value, error) -> null);
        }
        return result;
    }

    private <T> CompletionStage<T> execute(String name, WriteOperation<T> operation, long enqueuedAt) {
        long waitedMs = millisSince(enqueuedAt);
        if (waitedMs > settings.getWaitWarningThreshold().toMillis()) {
            log.warn("Operation \"{}\" waited {}ms in write queue", name, waitedMs);
        }

        log.debug("Executing \"{}\" (queue depth: {})", name, currentDepth.get());
        queuedCounter.increment();
        runningOperation = name;

        Supplier<CompletionStage<T>> attempt = () -> runAttempt(operation);
        CompletionStage<T> retried;
        try {
            retried = Retry.decorateCompletionStage(retry, executor, attempt).get();
        } catch (RuntimeException e) {
            retried = CompletableFuture.failedFuture(e);
        }

        return retried.whenComplete((value, error) -> {
            currentDepth.decrementAndGet();
            runningOperation = null;
            long totalNanos = System.nanoTime() - enqueuedAt;
            durationTimer.record(totalNanos, TimeUnit.NANOSECONDS);

            if (error == null) {
                successCounter.increment();
                log.debug("Completed \"{}\" in {}ms", name, TimeUnit.NANOSECONDS.toMillis(totalNanos));
            } else {
                DatabaseErrorKind kind = DatabaseErrorClassifier.classify(error);
                Counter.builder("db.write.error")
                        .tag("kind", kind.name())
                        .register(meterRegistry)
                        .increment();
                log.error("Failed \"{}\" after {}ms ({}): {}",
                        name, TimeUnit.NANOSECONDS.toMillis(totalNanos), kind, error.getMessage(), error);
            }
        });
    }

    private static <T> CompletionStage<T> runAttempt(WriteOperation<T> operation) {
        CompletableFuture<T> attempt = new CompletableFuture<>();
        try {
            attempt.complete(operation.execute());
        } catch (Exception e) {
            attempt.completeExceptionally(e);
        }
        return attempt;
    }

    private void registerRetryListeners() {
        retry.getEventPublisher()
                .onRetry(event -> {
                    retryAttemptCounter.increment();
                    log.warn("Database busy during \"{}\", retrying (attempt {}/{}) after {}ms",
                            runningOperation, event.getNumberOfRetryAttempts(), settings.getMaxRetries(),
                            event.getWaitInterval().toMillis());
                })
                .onSuccess(event -> {
                    retrySuccessCounter.increment();
                    log.info("Operation \"{}\" succeeded after {} retries",
                            runningOperation, event.getNumberOfRetryAttempts());
                })
                .onError(event -> {
                    retryExhaustedCounter.increment();
                    log.error("Operation \"{}\" still busy after {} retries",
                            runningOperation, settings.getMaxRetries());
                });
    }

    /**
     * @return future completing once every write enqueued before this call has settled,
     * successfully or not
     */
    public CompletableFuture<Void> flush() {
        synchronized (chainLock) {
            return tail.copy();
        }
    }

    public WriteQueueStats getQueueStats() {
        return new WriteQueueStats(currentDepth.get(), maxDepth.get());
    }

    /**
     * Test support: forget the historical maximum depth.
     */
    public void resetQueueStats() {
        maxDepth.set(0);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int pending = currentDepth.get();
        if (pending > 0) {
            log.info("Draining {} pending write(s) before shutdown", pending);
        }
        try {
            flush().get(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Write queue did not drain within 5s, {} write(s) abandoned", currentDepth.get());
        } catch (ExecutionException e) {
            log.error("Unexpected failure while draining write queue: {}", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Writer thread still busy, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
