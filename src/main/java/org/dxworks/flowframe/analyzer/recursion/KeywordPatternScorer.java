package org.dxworks.flowframe.analyzer.recursion;

import org.dxworks.flowframe.model.recursion.PatternType;
import org.dxworks.flowframe.model.recursion.RecursionPattern;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores each pattern by the fraction of its vocabulary present in the function name and
 * body (lower-cased, whitespace removed). The best score wins; a best score of 0.3 or
 * less is reported as {@code generic} with confidence 0.5.
 */
public class KeywordPatternScorer implements PatternScorer {

    static final double MIN_SCORE = 0.3;
    static final double GENERIC_CONFIDENCE = 0.5;

    private static final Map<PatternType, List<String>> VOCABULARY = buildVocabulary();

    @Override
    public RecursionPattern score(String functionName, String bodyText) {
        String text = compact((functionName == null ? "" : functionName) + " " + (bodyText == null ? "" : bodyText));

        PatternType best = PatternType.GENERIC;
        double bestScore = 0;
        for (Map.Entry<PatternType, List<String>> entry : VOCABULARY.entrySet()) {
            List<String> words = entry.getValue();
            long hits = words.stream().filter(text::contains).count();
            double score = (double) hits / words.size();
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }

        if (bestScore <= MIN_SCORE) {
            return new RecursionPattern(PatternType.GENERIC, GENERIC_CONFIDENCE);
        }
        return new RecursionPattern(best, bestScore);
    }

    static String compact(String text) {
        return text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static Map<PatternType, List<String>> buildVocabulary() {
        Map<PatternType, List<String>> vocabulary = new EnumMap<>(PatternType.class);
        vocabulary.put(PatternType.FACTORIAL, List.of("factorial", "n-1", "*", "<=1", "return1"));
        vocabulary.put(PatternType.FIBONACCI, List.of("fib", "n-1", "n-2", "+", "<=1"));
        vocabulary.put(PatternType.TREE_TRAVERSAL, List.of("node", ".left", ".right", "null", "tree", "visit"));
        vocabulary.put(PatternType.BINARY_SEARCH, List.of("mid", "low", "high", "target", "search", "/2"));
        vocabulary.put(PatternType.MERGE_SORT, List.of("merge", "sort", "mid", "left", "right", "/2"));
        vocabulary.put(PatternType.QUICK_SORT, List.of("pivot", "partition", "sort", "low", "high"));
        return Collections.unmodifiableMap(vocabulary);
    }
}
