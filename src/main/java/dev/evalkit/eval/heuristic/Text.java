package dev.evalkit.eval.heuristic;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Tokenization helpers shared by the heuristic metrics. */
final class Text {
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private Text() {}

    /** Lowercases one code point at a time, so the code-point length never changes. */
    static String lower(String s) {
        var sb = new StringBuilder(s.length());
        s.codePoints().map(Character::toLowerCase).forEach(sb::appendCodePoint);
        return sb.toString();
    }

    static String normalize(String s, boolean caseSensitive) {
        return caseSensitive ? s : lower(s);
    }

    /** Splits on runs of Unicode whitespace. Leading and trailing whitespace yields no tokens. */
    static List<String> words(String s) {
        return Arrays.stream(WHITESPACE.split(s)).filter(w -> !w.isEmpty()).toList();
    }

    static Set<String> wordSet(String s) {
        return new LinkedHashSet<>(words(s));
    }

    static Set<String> charSet(String s) {
        Set<String> set = new LinkedHashSet<>();
        s.codePoints().forEach(cp -> set.add(new String(Character.toChars(cp))));
        return set;
    }

    /** Word counts, with each word stripped of leading and trailing non-alphanumerics. */
    static Map<String, Integer> wordFrequency(String s) {
        Map<String, Integer> freq = new HashMap<>();
        for (var word : words(s)) {
            var stripped = stripNonAlphanumericEdges(word);
            if (!stripped.isEmpty()) {
                freq.merge(stripped, 1, Integer::sum);
            }
        }
        return freq;
    }

    static int codePointLength(String s) {
        return s.codePointCount(0, s.length());
    }

    private static String stripNonAlphanumericEdges(String word) {
        int start = 0;
        int end = word.length();
        while (start < end) {
            int cp = word.codePointAt(start);
            if (Character.isLetterOrDigit(cp)) {
                break;
            }
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = word.codePointBefore(end);
            if (Character.isLetterOrDigit(cp)) {
                break;
            }
            end -= Character.charCount(cp);
        }
        return word.substring(start, end);
    }
}
