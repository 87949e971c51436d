package dev.evalkit.eval.heuristic;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.Metric;
import dev.evalkit.eval.MetricInput;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

class PatternMetricsTest {

    private static double score(Metric metric, String output) {
        return metric.score(EvalContext.background(), MetricInput.of("", output)).value();
    }

    @Test
    void regexMatchFindsAnywhere() {
        var metric = new RegexMatch("\\d+");
        assertEquals(1.0, score(metric, "order 123 shipped"));
        assertEquals(0.0, score(metric, "no digits"));
    }

    @Test
    void regexNotMatch() {
        var metric = new RegexNotMatch("(?i)error");
        assertEquals(1.0, score(metric, "all good"));
        var flagged = metric.score(EvalContext.background(), MetricInput.of("", "ERROR: x"));
        assertEquals(0.0, flagged.value());
        assertEquals("matches pattern (unexpected)", flagged.reason().orElseThrow());
    }

    @Test
    void invalidRegexIsRejected() {
        assertThrows(PatternSyntaxException.class, () -> new RegexMatch("(unclosed"));
        assertThrows(PatternSyntaxException.class, () -> PatternMetric.date("[bad"));
    }

    @Test
    void regexFindAllCountsMatches() {
        var bounded = new RegexFindAll("\\d", 2, 3);
        assertEquals(1.0, score(bounded, "1 and 2"));
        assertEquals(0.0, score(bounded, "1 2 3 4"));
        assertEquals(0.0, score(bounded, "1"));

        var unbounded = new RegexFindAll("\\d", 1, 0);
        assertEquals(1.0, score(unbounded, "1 2 3 4 5 6 7"));
    }

    @Test
    void regexFindAllNormalizes() {
        var metric = new RegexFindAll("\\d", 0, 0, 4);
        assertEquals(0.5, score(metric, "1 2"), 1e-9);
        assertEquals(1.0, score(metric, "123456"));
        assertEquals(0.0, score(metric, "none"));
    }

    @Test
    void email() {
        var metric = PatternMetric.email();
        assertEquals("email_format", metric.getName());
        assertEquals(1.0, score(metric, "user.name+tag@example.co.uk"));
        assertEquals(1.0, score(metric, "  user@example.com\n"));
        assertEquals(0.0, score(metric, "not-an-email"));
        assertEquals(
                "invalid email format",
                metric.score(EvalContext.background(), MetricInput.of("", "x@y"))
                        .reason()
                        .orElseThrow());
    }

    @Test
    void url() {
        var metric = PatternMetric.url();
        assertEquals(1.0, score(metric, "https://example.com/path?q=1"));
        assertEquals(1.0, score(metric, "http://localhost:8080"));
        assertEquals(0.0, score(metric, "ftp://example.com"));
        assertEquals(0.0, score(metric, "https://exa mple.com"));
    }

    @Test
    void phone() {
        var metric = PatternMetric.phone();
        assertEquals(1.0, score(metric, "+1-234-567-8901"));
        assertEquals(1.0, score(metric, "(234) 567-8901"));
        assertEquals(0.0, score(metric, "123"));
        assertEquals(0.0, score(metric, "call me maybe"));
    }

    @Test
    void date() {
        var metric = PatternMetric.date();
        assertEquals(1.0, score(metric, "2024-01-15"));
        assertEquals(1.0, score(metric, "2024/01/15T10:30:00"));
        assertEquals(0.0, score(metric, "Jan 15, 2024"));

        var custom = PatternMetric.date("^\\d{2}\\.\\d{2}\\.\\d{4}$");
        assertEquals(1.0, score(custom, "15.01.2024"));
        assertEquals(0.0, score(custom, "2024-01-15"));
    }

    @Test
    void uuid() {
        var metric = PatternMetric.uuid();
        assertEquals(1.0, score(metric, "123e4567-e89b-12d3-a456-426614174000"));
        assertEquals(0.0, score(metric, "123e4567-e89b-12d3-a456"));
    }
}
