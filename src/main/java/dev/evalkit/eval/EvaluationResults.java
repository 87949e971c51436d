package dev.evalkit.eval;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;
import javax.annotation.Nonnull;

/** Results of evaluating a collection of items, with cross-item aggregates. */
public record EvaluationResults(@Nonnull List<EvaluationResult> results)
        implements Iterable<EvaluationResult> {

    public EvaluationResults {
        results = List.copyOf(results);
    }

    public static EvaluationResults of(EvaluationResult... results) {
        return new EvaluationResults(List.of(results));
    }

    public EvaluationResults successful() {
        return new EvaluationResults(stream().filter(EvaluationResult::isSuccess).toList());
    }

    public EvaluationResults failed() {
        return new EvaluationResults(stream().filter(r -> !r.isSuccess()).toList());
    }

    /**
     * Average of the named metric across items.
     *
     * <p>Each item contributes its first score with that name, and only if that score succeeded.
     * Returns 0 when no item contributes.
     */
    public double averageByMetric(String metricName) {
        double sum = 0;
        int count = 0;
        for (var result : results) {
            var score = result.scores().byName(metricName);
            if (score.isPresent() && score.get().isSuccess()) {
                sum += score.get().value();
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /** Every metric name observed in the collection mapped to its {@link #averageByMetric}. */
    public Map<String, Double> summary() {
        Set<String> metricNames = new LinkedHashSet<>();
        for (var result : results) {
            for (var score : result.scores()) {
                metricNames.add(score.name());
            }
        }
        Map<String, Double> summary = new LinkedHashMap<>();
        for (var name : metricNames) {
            summary.put(name, averageByMetric(name));
        }
        return summary;
    }

    public int size() {
        return results.size();
    }

    public EvaluationResult get(int index) {
        return results.get(index);
    }

    public Stream<EvaluationResult> stream() {
        return results.stream();
    }

    @Override
    public Iterator<EvaluationResult> iterator() {
        return results.iterator();
    }

    public String createReportString() {
        var sb = new StringBuilder();
        sb.append("Evaluated ").append(size()).append(" item(s): ");
        sb.append(successful().size()).append(" succeeded, ");
        sb.append(failed().size()).append(" failed\n");
        for (var entry : new TreeMap<>(summary()).entrySet()) {
            sb.append(
                    String.format(
                            Locale.ROOT, "  %s: %.4f\n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
