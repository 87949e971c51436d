package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.Metric;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts JSON from free-form output and scores it with another metric.
 *
 * <p>Looks, in order, for a fenced code block, output that is itself an object or array, and the
 * first flat {@code {...}} or {@code [...]} inside the text. If nothing is found the score is 0.
 * Otherwise the inner metric's result is returned unchanged.
 */
public final class ExtractJson extends BaseMetric {
    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*}");
    private static final Pattern FLAT_ARRAY = Pattern.compile("\\[[^\\[\\]]*]");

    private final Metric metric;

    public ExtractJson(Metric metric) {
        super("extract_json");
        this.metric = Objects.requireNonNull(metric);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var extracted = extract(input.output());
        if (extracted.isEmpty()) {
            return fail("no JSON found in output");
        }
        return metric.score(ctx, input.withOutput(extracted.get()));
    }

    static Optional<String> extract(String text) {
        var codeBlock = CODE_BLOCK.matcher(text);
        if (codeBlock.find()) {
            return Optional.of(codeBlock.group(1).strip());
        }

        var trimmed = text.strip();
        if ((trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"))) {
            return Optional.of(trimmed);
        }

        var object = FLAT_OBJECT.matcher(trimmed);
        if (object.find()) {
            return Optional.of(object.group());
        }
        var array = FLAT_ARRAY.matcher(trimmed);
        if (array.find()) {
            return Optional.of(array.group());
        }
        return Optional.empty();
    }
}
