package dev.evalkit.eval;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import javax.annotation.Nonnull;

/** An ordered, immutable sequence of scores. */
public record ScoreResults(@Nonnull List<ScoreResult> scores) implements Iterable<ScoreResult> {
    private static final ScoreResults EMPTY = new ScoreResults(List.of());

    public ScoreResults {
        scores = List.copyOf(scores);
    }

    public static ScoreResults empty() {
        return EMPTY;
    }

    public static ScoreResults of(ScoreResult... scores) {
        return new ScoreResults(List.of(scores));
    }

    /** The first score with the given name. */
    public Optional<ScoreResult> byName(String name) {
        return stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public ScoreResults allByName(String name) {
        return filter(s -> s.name().equals(name));
    }

    public ScoreResults successful() {
        return filter(ScoreResult::isSuccess);
    }

    public ScoreResults failed() {
        return filter(s -> !s.isSuccess());
    }

    /** Mean value of the successful scores, or 0 if there are none. */
    public double average() {
        return meanOf(successful());
    }

    /** Mean value of the successful scores named {@code name}, or 0 if there are none. */
    public double averageByName(String name) {
        return meanOf(allByName(name).successful());
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public ScoreResult get(int index) {
        return scores.get(index);
    }

    public Stream<ScoreResult> stream() {
        return scores.stream();
    }

    @Override
    public Iterator<ScoreResult> iterator() {
        return scores.iterator();
    }

    private ScoreResults filter(Predicate<ScoreResult> predicate) {
        return new ScoreResults(stream().filter(predicate).toList());
    }

    private static double meanOf(ScoreResults results) {
        if (results.isEmpty()) {
            return 0.0;
        }
        return results.stream().mapToDouble(ScoreResult::value).sum() / results.size();
    }
}
