package dev.evalkit.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/** Evaluates raw dataset records by mapping each one onto a {@link MetricInput}. */
@Slf4j
public final class DatasetEvaluator {
    private final Engine engine;
    private final Function<Map<String, Object>, MetricInput> inputMapper;

    public DatasetEvaluator(Engine engine, Function<Map<String, Object>, MetricInput> inputMapper) {
        this.engine = Objects.requireNonNull(engine);
        this.inputMapper = Objects.requireNonNull(inputMapper);
    }

    /** Maps every record and evaluates them in order. See {@link Engine#evaluateMany}. */
    public EvaluationResults evaluate(EvalContext ctx, List<Map<String, Object>> records) {
        List<MetricInput> inputs = new ArrayList<>(records.size());
        for (var record : records) {
            inputs.add(inputMapper.apply(record));
        }
        return engine.evaluateMany(ctx, inputs);
    }

    /** Reads every record from {@code dataset} and evaluates them in cursor order. */
    public EvaluationResults evaluate(EvalContext ctx, Dataset dataset) {
        List<Map<String, Object>> records = new ArrayList<>();
        try (var cursor = dataset.openCursor()) {
            var next = cursor.next();
            while (next.isPresent()) {
                records.add(next.get());
                next = cursor.next();
            }
        }
        log.debug("Read {} record(s) from dataset {}", records.size(), dataset.id());
        return evaluate(ctx, records);
    }

    public Engine getEngine() {
        return engine;
    }

    /**
     * A mapper reading string values at the given keys. Missing or non-string values map to the
     * empty string. The whole record is kept as the input's metadata.
     */
    public static Function<Map<String, Object>, MetricInput> defaultInputMapper(
            String inputKey, String outputKey, String expectedKey) {
        return record ->
                new MetricInput(
                        stringAt(record, inputKey),
                        stringAt(record, outputKey),
                        stringAt(record, expectedKey),
                        "",
                        record);
    }

    private static String stringAt(Map<String, Object> record, String key) {
        return record.get(key) instanceof String s ? s : "";
    }
}
