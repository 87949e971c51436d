package dev.evalkit.eval;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.config.EvalConfig;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EngineTest {
    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;

    @BeforeEach
    void beforeEach() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build();
    }

    @AfterEach
    void afterEach() {
        tracerProvider.close();
    }

    private Engine.Builder engineBuilder() {
        return Engine.builder().tracer(tracerProvider.get(Engine.INSTRUMENTATION_NAME));
    }

    private static Metric outputEquals() {
        return Metric.of(
                "output_equals", input -> input.output().equals(input.expected()) ? 1.0 : 0.0);
    }

    private static Metric outputLength() {
        return Metric.of("output_length", input -> input.output().length() / 10.0);
    }

    private static List<MetricInput> inputs(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> MetricInput.of("q" + i, "answer-" + i).withExpected("answer-" + i))
                .toList();
    }

    @SneakyThrows
    private static void randomPause() {
        Thread.sleep(ThreadLocalRandom.current().nextInt(1, 15));
    }

    @Test
    void scoresFollowMetricRegistrationOrder() {
        var engine = engineBuilder().metrics(outputLength(), outputEquals()).build();
        var result = engine.evaluateOne(EvalContext.background(), inputs(1).get(0));

        assertTrue(result.isSuccess());
        assertEquals("", result.itemId());
        assertEquals(2, result.scores().size());
        assertEquals("output_length", result.scores().get(0).name());
        assertEquals("output_equals", result.scores().get(1).name());
        assertEquals(1.0, result.scores().get(1).value());
    }

    @Test
    void evaluateManyAssignsPositionalIds() {
        var engine = engineBuilder().metrics(outputEquals()).build();
        var results = engine.evaluateMany(EvalContext.background(), inputs(3));

        assertEquals(3, results.size());
        for (int i = 0; i < 3; i++) {
            assertEquals("item-" + i, results.get(i).itemId());
            assertEquals("q" + i, results.get(i).input().input());
        }
        assertEquals(1.0, results.averageByMetric("output_equals"));
    }

    @Test
    void concurrentResultsKeepInputOrder() {
        Metric slow =
                Metric.of(
                        "echo_index",
                        (ctx, input) -> {
                            randomPause();
                            return ScoreResult.of(
                                    "echo_index", Double.parseDouble(input.input().substring(1)));
                        });
        var engine = engineBuilder().metrics(slow).concurrency(4).build();
        var results = engine.evaluateMany(EvalContext.background(), inputs(20));

        assertEquals(20, results.size());
        for (int i = 0; i < 20; i++) {
            var result = results.get(i);
            assertEquals("item-" + i, result.itemId());
            assertEquals((double) i, result.scores().get(0).value());
        }
    }

    @Test
    void concurrentRunScoresEachInputExactlyOnce() {
        var calls = new AtomicInteger();
        Set<String> seen = ConcurrentHashMap.newKeySet();
        Metric counting =
                Metric.of(
                        "counting",
                        input -> {
                            calls.incrementAndGet();
                            assertTrue(seen.add(input.input()), "scored twice: " + input.input());
                            randomPause();
                            return 1.0;
                        });
        var engine = engineBuilder().metrics(counting).concurrency(4).build();
        var results = engine.evaluateMany(EvalContext.background(), inputs(10));

        assertEquals(10, results.size());
        assertEquals(10, calls.get());
        assertEquals(10, seen.size());
        assertEquals(1.0, results.averageByMetric("counting"));
    }

    @Test
    void concurrencyBoundsItemsInFlight() {
        var inFlight = new AtomicInteger();
        var maxInFlight = new AtomicInteger();
        Metric tracking =
                Metric.of(
                        "tracking",
                        (ctx, input) -> {
                            int now = inFlight.incrementAndGet();
                            maxInFlight.accumulateAndGet(now, Math::max);
                            randomPause();
                            inFlight.decrementAndGet();
                            return ScoreResult.of("tracking", 1.0);
                        });
        var engine = engineBuilder().metrics(tracking).concurrency(3).build();
        engine.evaluateMany(EvalContext.background(), inputs(15));

        assertTrue(maxInFlight.get() >= 1);
        assertTrue(maxInFlight.get() <= 3, "max in flight: " + maxInFlight.get());
        assertEquals(0, inFlight.get());
    }

    @Test
    void concurrentItemsRunOnWorkerThreads() {
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        Metric recording =
                Metric.of(
                        "recording",
                        input -> {
                            threadNames.add(Thread.currentThread().getName());
                            return 1.0;
                        });
        engineBuilder()
                .metrics(recording)
                .concurrency(2)
                .build()
                .evaluateMany(EvalContext.background(), inputs(4));

        assertFalse(threadNames.isEmpty());
        for (var name : threadNames) {
            assertTrue(name.startsWith("evalkit-eval-"), name);
        }
    }

    @Test
    void nonPositiveConcurrencyIsIgnored() {
        assertEquals(1, Engine.builder().concurrency(0).build().getConcurrency());
        assertEquals(4, Engine.builder().concurrency(4).concurrency(-2).build().getConcurrency());
    }

    @Test
    void configSetsConcurrency() {
        var config = EvalConfig.builder().concurrency(6).debug(true).build();
        var engine = engineBuilder().metrics(outputEquals()).config(config).build();

        assertEquals(6, engine.getConcurrency());
        var results = engine.evaluateMany(EvalContext.background(), inputs(3));
        assertEquals(1.0, results.averageByMetric("output_equals"));
    }

    @Test
    void sequentialCallbacksCountUp() {
        List<Integer> completed = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        var engine =
                engineBuilder()
                        .metrics(outputEquals())
                        .callback(
                                (done, total, result) -> {
                                    assertEquals(4, total);
                                    completed.add(done);
                                    ids.add(result.itemId());
                                })
                        .build();
        engine.evaluateMany(EvalContext.background(), inputs(4));

        assertEquals(List.of(1, 2, 3, 4), completed);
        assertEquals(List.of("item-0", "item-1", "item-2", "item-3"), ids);
    }

    @Test
    void concurrentCallbacksAreSerialized() {
        var inCallback = new AtomicBoolean();
        var overlapped = new AtomicBoolean();
        List<Integer> completed = Collections.synchronizedList(new ArrayList<>());
        Metric slow =
                Metric.of(
                        "slow",
                        input -> {
                            randomPause();
                            return 1.0;
                        });
        var engine =
                engineBuilder()
                        .metrics(slow)
                        .concurrency(4)
                        .callback(
                                (done, total, result) -> {
                                    if (!inCallback.compareAndSet(false, true)) {
                                        overlapped.set(true);
                                    }
                                    completed.add(done);
                                    randomPause();
                                    inCallback.set(false);
                                })
                        .build();
        engine.evaluateMany(EvalContext.background(), inputs(12));

        assertFalse(overlapped.get(), "callbacks overlapped");
        assertEquals(IntStream.rangeClosed(1, 12).boxed().toList(), completed);
    }

    @Test
    void callbacksRunInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        var engine =
                engineBuilder()
                        .metrics(outputEquals())
                        .callback((done, total, result) -> calls.add("first-" + done))
                        .callback((done, total, result) -> calls.add("second-" + done))
                        .build();
        engine.evaluateMany(EvalContext.background(), inputs(2));

        assertEquals(List.of("first-1", "second-1", "first-2", "second-2"), calls);
    }

    @Test
    void throwingCallbackPropagates() {
        var error = new IllegalStateException("callback failed");
        for (int concurrency : new int[] {1, 3}) {
            var engine =
                    engineBuilder()
                            .metrics(outputEquals())
                            .concurrency(concurrency)
                            .callback(
                                    (done, total, result) -> {
                                        throw error;
                                    })
                            .build();
            var thrown =
                    assertThrows(
                            IllegalStateException.class,
                            () -> engine.evaluateMany(EvalContext.background(), inputs(3)));
            assertSame(error, thrown);
        }
    }

    @Test
    void throwingMetricBecomesFailedScore() {
        var error = new IllegalArgumentException("bad input");
        Metric throwing =
                Metric.of(
                        "throwing",
                        (ctx, input) -> {
                            throw error;
                        });
        Metric returnsNull = Metric.of("returns_null", (ctx, input) -> null);
        var engine = engineBuilder().metrics(throwing, returnsNull, outputEquals()).build();
        var result = engine.evaluateOne(EvalContext.background(), inputs(1).get(0));

        assertTrue(result.isSuccess());
        assertEquals(3, result.scores().size());
        var failed = result.scores().get(0);
        assertEquals("throwing", failed.name());
        assertSame(error, failed.error().orElseThrow());
        assertInstanceOf(
                NullPointerException.class, result.scores().get(1).error().orElseThrow());
        assertEquals(1.0, result.averageScore());
    }

    @Test
    void cancellationStopsBeforeNextMetric() {
        var ctx = EvalContext.cancellable();
        var secondCalls = new AtomicInteger();
        Metric cancelling =
                Metric.of(
                        "cancelling",
                        (c, input) -> {
                            ctx.cancel("stop");
                            return ScoreResult.of("cancelling", 1.0);
                        });
        Metric second =
                Metric.of(
                        "second",
                        input -> {
                            secondCalls.incrementAndGet();
                            return 1.0;
                        });
        var engine = engineBuilder().metrics(cancelling, second).build();
        var result = engine.evaluateOne(ctx, inputs(1).get(0));

        assertEquals(0, secondCalls.get());
        assertEquals(1, result.scores().size());
        assertFalse(result.isSuccess());
        var cancellation =
                assertInstanceOf(CancellationException.class, result.error().orElseThrow());
        assertEquals("stop", cancellation.getMessage());
        assertSame(ctx.error().orElseThrow(), cancellation);
    }

    @Test
    void cancelledContextStillYieldsResultPerItem() {
        var ctx = EvalContext.cancellable();
        ctx.cancel();
        for (int concurrency : new int[] {1, 4}) {
            var results =
                    engineBuilder()
                            .metrics(outputEquals())
                            .concurrency(concurrency)
                            .build()
                            .evaluateMany(ctx, inputs(5));

            assertEquals(5, results.size());
            assertEquals(5, results.failed().size());
            for (var result : results) {
                assertTrue(result.scores().isEmpty());
            }
        }
    }

    @Test
    void noMetricsYieldsEmptySuccessfulResult() {
        var result =
                engineBuilder().build().evaluateOne(EvalContext.background(), MetricInput.empty());

        assertTrue(result.isSuccess());
        assertTrue(result.scores().isEmpty());
        assertEquals(0.0, result.averageScore());
    }

    @Test
    void emptyBatchInvokesNoCallbacks() {
        var calls = new AtomicInteger();
        var engine =
                engineBuilder()
                        .metrics(outputEquals())
                        .concurrency(2)
                        .callback((done, total, result) -> calls.incrementAndGet())
                        .build();
        var results = engine.evaluateMany(EvalContext.background(), List.of());

        assertEquals(0, results.size());
        assertEquals(0, calls.get());
    }

    @Test
    void evaluateWithIdsReturnsEachIdOnce() {
        Map<String, MetricInput> items = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) {
            items.put("case-" + i, MetricInput.of("q", "a").withExpected(i % 2 == 0 ? "a" : "b"));
        }
        for (int concurrency : new int[] {1, 4}) {
            var completed = new AtomicInteger();
            var results =
                    engineBuilder()
                            .metrics(outputEquals())
                            .concurrency(concurrency)
                            .callback((done, total, result) -> completed.incrementAndGet())
                            .build()
                            .evaluateWithIds(EvalContext.background(), items);

            assertEquals(10, completed.get());
            var sorted =
                    results.stream()
                            .sorted(Comparator.comparing(EvaluationResult::itemId))
                            .toList();
            assertEquals(
                    items.keySet().stream().sorted().toList(),
                    sorted.stream().map(EvaluationResult::itemId).toList());
            assertEquals(0.5, results.averageByMetric("output_equals"), 1e-9);
        }
    }

    @Test
    void staticHelpersUseThrowawayEngines() {
        var results =
                Engine.evaluate(EvalContext.background(), List.of(outputEquals()), inputs(3), 2);
        assertEquals(3, results.size());
        assertEquals("item-2", results.get(2).itemId());

        var single =
                Engine.evaluateSingle(
                        EvalContext.background(), List.of(outputEquals()), inputs(1).get(0));
        assertEquals(1.0, single.scores().get(0).value());
    }

    @Test
    void getMetricsIsUnmodifiable() {
        var engine = Engine.of(outputEquals(), outputLength());
        assertEquals(2, engine.getMetrics().size());
        assertThrows(UnsupportedOperationException.class, () -> engine.getMetrics().clear());
    }

    @Test
    void emitsEvaluateAndScoreSpans() {
        Metric throwing =
                Metric.of(
                        "throwing",
                        (ctx, input) -> {
                            throw new IllegalStateException("boom");
                        });
        var engine = engineBuilder().metrics(outputEquals(), throwing).build();
        engine.evaluateMany(EvalContext.background(), inputs(1));

        var spans = spanExporter.getFinishedSpanItems();
        assertEquals(3, spans.size());
        Map<String, List<SpanData>> byName =
                spans.stream().collect(Collectors.groupingBy(SpanData::getName));

        var itemSpan = byName.get("evaluate").get(0);
        assertEquals("item-0", itemSpan.getAttributes().get(Engine.ITEM_ID));
        assertEquals(2L, itemSpan.getAttributes().get(Engine.METRIC_COUNT));

        var scoreSpans = byName.get("score");
        assertEquals(2, scoreSpans.size());
        for (var scoreSpan : scoreSpans) {
            assertEquals(itemSpan.getSpanId(), scoreSpan.getParentSpanId());
        }
        var okSpan =
                scoreSpans.stream()
                        .filter(s -> "output_equals".equals(s.getAttributes().get(Engine.METRIC)))
                        .findFirst()
                        .orElseThrow();
        assertEquals(1.0, okSpan.getAttributes().get(Engine.SCORE));
        var errorSpan =
                scoreSpans.stream()
                        .filter(s -> "throwing".equals(s.getAttributes().get(Engine.METRIC)))
                        .findFirst()
                        .orElseThrow();
        assertEquals(StatusCode.ERROR, errorSpan.getStatus().getStatusCode());
        assertNull(errorSpan.getAttributes().get(Engine.SCORE));
    }
}
