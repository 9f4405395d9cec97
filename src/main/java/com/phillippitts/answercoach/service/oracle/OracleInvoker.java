package com.phillippitts.answercoach.service.oracle;

import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs oracle calls on the bounded {@code oracleExecutor} with a hard deadline and turns every
 * failure into an empty result.
 *
 * <p><b>Degradation:</b> a call that throws, times out or returns {@code null} yields
 * {@link Optional#empty()}. The caller substitutes its conservative fallback; nothing here ever
 * propagates to the evaluation cycle.
 *
 * <p><b>Batches:</b> {@link #invokeAll(String, List)} starts every call at once and waits for all of
 * them against one shared deadline, so a cycle assessing N bullets costs one timeout, not N.
 *
 * <p>Each failure is logged at WARN, counted in metrics under reason {@code timeout},
 * {@code unavailable} or {@code unexpected}, and published as an {@link OracleFailureEvent}.
 * Per-oracle call statistics back the oracle health indicator.
 *
 * @since 1.0
 */
public class OracleInvoker {

    private static final Logger LOG = LogManager.getLogger(OracleInvoker.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_UNAVAILABLE = "unavailable";
    static final String REASON_UNEXPECTED = "unexpected";

    private final Executor executor;
    private final long timeoutMs;
    private final CoverageMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Map<String, Stats> stats = new ConcurrentHashMap<>();

    public OracleInvoker(Executor executor,
                         long timeoutMs,
                         CoverageMetricsPublisher metrics,
                         ApplicationEventPublisher publisher,
                         Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeoutMs = timeoutMs <= 0 ? 8_000 : timeoutMs;
        this.metrics = metrics == null ? CoverageMetricsPublisher.NOOP : metrics;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Invokes one oracle call.
     *
     * @param oracle oracle name for logs, metrics and health
     * @param call   the blocking call
     * @param <T>    result type
     * @return the result, or empty when the call failed
     */
    public <T> Optional<T> invoke(String oracle, Supplier<T> call) {
        return invokeAll(oracle, List.of(call)).get(0);
    }

    /**
     * Invokes several calls to the same oracle in parallel under one deadline.
     *
     * @param oracle oracle name
     * @param calls  blocking calls
     * @param <T>    result type
     * @return one entry per call, same order; empty where the call failed
     */
    public <T> List<Optional<T>> invokeAll(String oracle, List<? extends Supplier<T>> calls) {
        Objects.requireNonNull(oracle, "oracle");
        Objects.requireNonNull(calls, "calls");
        if (calls.isEmpty()) {
            return List.of();
        }

        final long t0 = System.nanoTime();
        List<CompletableFuture<Timed<T>>> futures = new ArrayList<>(calls.size());
        for (Supplier<T> call : calls) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> runTimed(call), executor));
            } catch (RejectedExecutionException ree) {
                futures.add(CompletableFuture.failedFuture(ree));
            }
        }

        boolean timedOut = false;
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            timedOut = true;
            LOG.warn("Oracle '{}' timed out after {} ms ({} call(s))", oracle, timeoutMs, calls.size());
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException ee) {
            // Failures are collected per call below
            LOG.debug("Oracle '{}' batch completed with failures", oracle);
        }

        long batchNanos = System.nanoTime() - t0;
        List<Optional<T>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<Timed<T>> future : futures) {
            results.add(collect(oracle, future, batchNanos, timedOut));
        }
        return results;
    }

    /**
     * Call statistics for one oracle.
     *
     * @param oracle oracle name
     * @return statistics, zeroed if the oracle was never called
     */
    public OracleStatus status(String oracle) {
        Stats s = stats.get(oracle);
        return s == null ? new OracleStatus(0, 0, null, null) : s.snapshot();
    }

    /**
     * Statistics for every oracle called so far, sorted by name.
     */
    public Map<String, OracleStatus> statuses() {
        Map<String, OracleStatus> out = new TreeMap<>();
        stats.forEach((name, s) -> out.put(name, s.snapshot()));
        return out;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    private <T> Timed<T> runTimed(Supplier<T> call) {
        long start = System.nanoTime();
        T value = call.get();
        return new Timed<>(value, System.nanoTime() - start);
    }

    private <T> Optional<T> collect(String oracle, CompletableFuture<Timed<T>> future,
                                    long batchNanos, boolean timedOut) {
        if (!future.isDone() || future.isCancelled()) {
            fail(oracle, batchNanos, timedOut ? REASON_TIMEOUT : REASON_UNEXPECTED,
                    timedOut ? "no answer within " + timeoutMs + " ms" : "call cancelled", null);
            return Optional.empty();
        }
        try {
            Timed<T> timed = future.join();
            if (timed.value() == null) {
                fail(oracle, timed.nanos(), REASON_UNEXPECTED, "oracle returned no result", null);
                return Optional.empty();
            }
            succeed(oracle, timed.nanos());
            return Optional.of(timed.value());
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof OracleUnavailableException || cause instanceof RejectedExecutionException) {
                fail(oracle, batchNanos, REASON_UNAVAILABLE, cause.getMessage(), null);
            } else {
                fail(oracle, batchNanos, REASON_UNEXPECTED, cause.toString(), cause);
            }
            return Optional.empty();
        }
    }

    private void succeed(String oracle, long nanos) {
        stats.computeIfAbsent(oracle, k -> new Stats()).success(clock.instant());
        metrics.recordOracleSuccess(oracle, nanos);
    }

    private void fail(String oracle, long nanos, String reason, String message, Throwable unexpected) {
        Instant now = clock.instant();
        stats.computeIfAbsent(oracle, k -> new Stats()).failure(now);
        metrics.recordOracleFailure(oracle, nanos, reason);
        if (unexpected != null) {
            LOG.warn("Oracle '{}' failed unexpectedly, using fallback", oracle, unexpected);
        } else {
            LOG.warn("Oracle '{}' degraded ({}): {}", oracle, reason, message);
        }
        publisher.publishEvent(new OracleFailureEvent(oracle, reason, message, now));
    }

    private record Timed<T>(T value, long nanos) {
    }

    private static final class Stats {
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private volatile Instant lastSuccess;
        private volatile Instant lastFailure;

        void success(Instant at) {
            successes.incrementAndGet();
            lastSuccess = at;
        }

        void failure(Instant at) {
            failures.incrementAndGet();
            lastFailure = at;
        }

        OracleStatus snapshot() {
            return new OracleStatus(successes.get(), failures.get(), lastSuccess, lastFailure);
        }
    }
}
