package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.regex.Pattern;

/**
 * Checks that the trimmed output has a particular format, such as an email address or a UUID.
 *
 * <p>Use the factory methods for the built-in formats.
 */
public final class PatternMetric extends BaseMetric {
    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern URL = Pattern.compile("^https?://[^\\s/$.?#].[^\\s]*$");
    // +1-234-567-8901, (234) 567-8901, ...
    private static final Pattern PHONE = Pattern.compile("^[+]?[(]?[0-9]{1,4}[)]?[-\\s./0-9]*$");
    private static final Pattern ISO_DATE =
            Pattern.compile("^\\d{4}[-/]\\d{2}[-/]\\d{2}(T\\d{2}:\\d{2}(:\\d{2})?)?");
    private static final Pattern UUID =
            Pattern.compile(
                    "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final Pattern pattern;
    private final String label;
    private final int minLength;

    private PatternMetric(String name, Pattern pattern, String label, int minLength) {
        super(name);
        this.pattern = pattern;
        this.label = label;
        this.minLength = minLength;
    }

    public static PatternMetric email() {
        return new PatternMetric("email_format", EMAIL, "email", 0);
    }

    public static PatternMetric url() {
        return new PatternMetric("url_format", URL, "URL", 0);
    }

    /** Phone numbers must also be at least seven characters long. */
    public static PatternMetric phone() {
        return new PatternMetric("phone_format", PHONE, "phone", 7);
    }

    /** ISO 8601 style dates, optionally followed by a time. */
    public static PatternMetric date() {
        return new PatternMetric("date_format", ISO_DATE, "date", 0);
    }

    /** @throws java.util.regex.PatternSyntaxException if {@code regex} is invalid */
    public static PatternMetric date(String regex) {
        return new PatternMetric("date_format", Pattern.compile(regex), "date", 0);
    }

    public static PatternMetric uuid() {
        return new PatternMetric("uuid_format", UUID, "UUID", 0);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var output = input.output().strip();
        if (output.length() >= minLength && pattern.matcher(output).find()) {
            return pass("valid " + label + " format");
        }
        return fail("invalid " + label + " format");
    }
}
