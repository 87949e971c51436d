package dev.evalkit.eval;

import dev.evalkit.config.EvalConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed set of metrics against one or many inputs.
 *
 * <p>With a concurrency of 1 items are evaluated one after another on the calling thread. With a
 * higher concurrency up to that many items are evaluated at once; results are still returned in
 * input order and progress callbacks are still invoked one at a time.
 *
 * <p>Cancellation is cooperative: the {@link EvalContext} is checked before each metric, never
 * during one.
 */
@Slf4j
@ThreadSafe
public final class Engine {
    static final String INSTRUMENTATION_NAME = "evalkit";
    static final AttributeKey<String> ITEM_ID = AttributeKey.stringKey("evalkit.item_id");
    static final AttributeKey<Long> METRIC_COUNT = AttributeKey.longKey("evalkit.metric_count");
    static final AttributeKey<String> METRIC = AttributeKey.stringKey("evalkit.metric");
    static final AttributeKey<Double> SCORE = AttributeKey.doubleKey("evalkit.score");

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final @Nonnull List<Metric> metrics;
    private final int concurrency;
    private final boolean debug;
    private final @Nonnull List<ProgressCallback> callbacks;
    private final @Nonnull Tracer tracer;

    private Engine(Builder builder) {
        this.metrics = List.copyOf(builder.metrics);
        this.concurrency = builder.concurrency;
        this.debug = builder.debug;
        this.callbacks = List.copyOf(builder.callbacks);
        this.tracer = Objects.requireNonNull(builder.tracer);
    }

    /** Evaluates {@code input} against every metric in registration order. */
    public EvaluationResult evaluateOne(EvalContext ctx, MetricInput input) {
        return evaluateItem(ctx, "", input);
    }

    /**
     * Evaluates every input. The result at index {@code i} always belongs to input {@code i} and
     * carries the item id {@code item-<i>}.
     *
     * <p>Blocks until every item has been evaluated.
     */
    public EvaluationResults evaluateMany(EvalContext ctx, List<MetricInput> inputs) {
        final int total = inputs.size();
        log.debug(
                "Evaluating {} item(s) against {} metric(s) with concurrency {}",
                total,
                metrics.size(),
                concurrency);
        if (concurrency <= 1) {
            List<EvaluationResult> results = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                var result = evaluateItem(ctx, itemId(i), inputs.get(i));
                results.add(result);
                notifyCallbacks(i + 1, total, result);
            }
            return new EvaluationResults(results);
        }

        final EvaluationResult[] slots = new EvaluationResult[total];
        final Completion completion = new Completion(total);
        List<Runnable> tasks = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int index = i;
            final MetricInput input = inputs.get(i);
            tasks.add(
                    () -> {
                        var result = evaluateItem(ctx, itemId(index), input);
                        completion.publish(result, r -> slots[index] = r);
                    });
        }
        runConcurrently(tasks);
        return new EvaluationResults(Arrays.asList(slots));
    }

    /**
     * Evaluates inputs keyed by caller-chosen identifiers.
     *
     * <p>Every identifier appears exactly once in the result. The order of results is
     * unspecified; callers needing a stable order should sort by {@link
     * EvaluationResult#itemId()}.
     */
    public EvaluationResults evaluateWithIds(EvalContext ctx, Map<String, MetricInput> items) {
        final int total = items.size();
        log.debug(
                "Evaluating {} identified item(s) against {} metric(s) with concurrency {}",
                total,
                metrics.size(),
                concurrency);
        if (concurrency <= 1) {
            List<EvaluationResult> results = new ArrayList<>(total);
            for (var item : items.entrySet()) {
                var result = evaluateItem(ctx, item.getKey(), item.getValue());
                results.add(result);
                notifyCallbacks(results.size(), total, result);
            }
            return new EvaluationResults(results);
        }

        final List<EvaluationResult> results = new ArrayList<>(total);
        final Completion completion = new Completion(total);
        List<Runnable> tasks = new ArrayList<>(total);
        for (var item : items.entrySet()) {
            final String id = item.getKey();
            final MetricInput input = item.getValue();
            tasks.add(
                    () -> {
                        var result = evaluateItem(ctx, id, input);
                        completion.publish(result, results::add);
                    });
        }
        runConcurrently(tasks);
        return new EvaluationResults(results);
    }

    /** The registered metrics, in registration order. Unmodifiable. */
    public List<Metric> getMetrics() {
        return metrics;
    }

    public int getConcurrency() {
        return concurrency;
    }

    private EvaluationResult evaluateItem(EvalContext ctx, String itemId, MetricInput input) {
        var spanBuilder =
                tracer.spanBuilder("evaluate").setAttribute(METRIC_COUNT, (long) metrics.size());
        if (!itemId.isEmpty()) {
            spanBuilder.setAttribute(ITEM_ID, itemId);
        }
        var itemSpan = spanBuilder.startSpan();
        List<ScoreResult> scores = new ArrayList<>(metrics.size());
        try (var unused = itemSpan.makeCurrent()) {
            for (var metric : metrics) {
                var cancellation = ctx.error();
                if (cancellation.isPresent()) {
                    log.debug(
                            "Evaluation cancelled after {} of {} metric(s)",
                            scores.size(),
                            metrics.size());
                    itemSpan.setStatus(StatusCode.ERROR, cancellation.get().getMessage());
                    return new EvaluationResult(
                            itemId,
                            input,
                            new ScoreResults(scores),
                            Optional.of(cancellation.get()));
                }
                scores.add(runMetric(ctx, metric, input));
            }
            if (debug) {
                log.info("Evaluated item '{}': {}", itemId, scores);
            }
            return new EvaluationResult(
                    itemId, input, new ScoreResults(scores), Optional.empty());
        } finally {
            itemSpan.end();
        }
    }

    /** Runs one metric. A metric which throws is recorded as a failed score. */
    private ScoreResult runMetric(EvalContext ctx, Metric metric, MetricInput input) {
        var scoreSpan =
                tracer.spanBuilder("score").setAttribute(METRIC, metric.getName()).startSpan();
        try (var unused = scoreSpan.makeCurrent()) {
            ScoreResult score;
            try {
                score =
                        Objects.requireNonNull(
                                metric.score(ctx, input),
                                "metric '%s' returned no score".formatted(metric.getName()));
            } catch (RuntimeException e) {
                log.debug("Metric '{}' threw exception", metric.getName(), e);
                score = ScoreResult.failed(metric.getName(), e);
            }
            recordScore(scoreSpan, score);
            return score;
        } finally {
            scoreSpan.end();
        }
    }

    private static void recordScore(Span scoreSpan, ScoreResult score) {
        if (score.isSuccess()) {
            scoreSpan.setAttribute(SCORE, score.value());
        } else {
            var error = score.error().orElseThrow();
            scoreSpan.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
            scoreSpan.recordException(error);
        }
    }

    /**
     * Runs every task, with at most {@link #concurrency} in flight, and waits for all of them. If
     * any task failed, the first failure is rethrown once all tasks have finished.
     */
    private void runConcurrently(List<Runnable> tasks) {
        var permits = new Semaphore(concurrency);
        ExecutorService executor = Executors.newCachedThreadPool(workerThreadFactory());
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
            for (var task : tasks) {
                permits.acquireUninterruptibly();
                futures.add(
                        CompletableFuture.runAsync(
                                () -> {
                                    try {
                                        task.run();
                                    } finally {
                                        permits.release();
                                    }
                                },
                                executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            } else if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private void notifyCallbacks(int completed, int total, EvaluationResult result) {
        for (var callback : callbacks) {
            callback.onProgress(completed, total, result);
        }
    }

    private static String itemId(int index) {
        return "item-" + index;
    }

    private static ThreadFactory workerThreadFactory() {
        return runnable -> {
            var thread = new Thread(runnable, "evalkit-eval-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** Serializes result publication, the completion count and callback dispatch. */
    private final class Completion {
        private final int total;
        private int completed = 0;

        Completion(int total) {
            this.total = total;
        }

        synchronized void publish(EvaluationResult result, Consumer<EvaluationResult> store) {
            store.accept(result);
            completed++;
            notifyCallbacks(completed, total, result);
        }
    }

    /** Evaluates {@code inputs} with a throwaway engine. */
    public static EvaluationResults evaluate(
            EvalContext ctx, List<Metric> metrics, List<MetricInput> inputs, int concurrency) {
        return builder()
                .metrics(metrics)
                .concurrency(concurrency)
                .build()
                .evaluateMany(ctx, inputs);
    }

    /** Evaluates a single input with a throwaway, sequential engine. */
    public static EvaluationResult evaluateSingle(
            EvalContext ctx, List<Metric> metrics, MetricInput input) {
        return builder().metrics(metrics).build().evaluateOne(ctx, input);
    }

    public static Engine of(Metric... metrics) {
        return builder().metrics(metrics).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for engines with a fluent API. */
    public static final class Builder {
        private @Nonnull List<Metric> metrics = List.of();
        private int concurrency = 1;
        private boolean debug = false;
        private final @Nonnull List<ProgressCallback> callbacks = new ArrayList<>();
        private @Nullable Tracer tracer;

        public Builder metrics(Metric... metrics) {
            return metrics(List.of(metrics));
        }

        public Builder metrics(List<Metric> metrics) {
            this.metrics = List.copyOf(metrics);
            return this;
        }

        /** Sets the maximum number of items evaluated at once. Values below 1 are ignored. */
        public Builder concurrency(int concurrency) {
            if (concurrency > 0) {
                this.concurrency = concurrency;
            }
            return this;
        }

        /** Applies engine settings from {@code config}. */
        public Builder config(EvalConfig config) {
            return concurrency(config.concurrency()).debug(config.debug());
        }

        /** Logs every item's scores at info level. */
        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /** Adds a progress callback. Callbacks are invoked in the order they were added. */
        public Builder callback(ProgressCallback callback) {
            this.callbacks.add(Objects.requireNonNull(callback));
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Engine build() {
            if (tracer == null) {
                tracer = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
            }
            return new Engine(this);
        }
    }
}
