package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.BlockType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ordered keyword table used to classify a line. Patterns are tested against the
 * trimmed, lower-cased content; the first type with a matching pattern wins.
 *
 * <p>Order matters: structural end markers ({@code End if}) must be seen before the bare
 * {@code end} of the program is ruled out, {@code else if} before {@code else}, and
 * function definitions before function calls.</p>
 */
public final class KeywordPatterns {

    /** Closes an {@code if} or {@code switch}: {@code End if}, {@code Endif}, {@code End switch}. */
    public static final Pattern CONDITIONAL_END_MARKER = Pattern.compile(
            "^(?:end\\s*(?:if|condition|switch|select)\\b.*|endif)$");

    /** Closes a loop: {@code End while}, {@code End for}, {@code Next}, {@code Wend}. */
    public static final Pattern LOOP_END_MARKER = Pattern.compile(
            "^(?:end\\s*(?:while|for|foreach|loop|repeat|do)\\b.*|endwhile|endfor|next(?:\\s+[a-z])?|wend)$");

    /** Lines that sit at their opening construct's level rather than nesting under it. */
    public static final Pattern BRANCH_CONTINUATION = Pattern.compile("^(?:else|case|default)(?:\\b|if\\b)");

    public static final Pattern CLOSING = Pattern.compile("^(?:else|end|case|default)(?:\\b|if\\b)");

    private static final Map<BlockType, List<Pattern>> TABLE = buildTable();

    private KeywordPatterns() {
        // utility class
    }

    public static Map<BlockType, List<Pattern>> table() {
        return TABLE;
    }

    private static Map<BlockType, List<Pattern>> buildTable() {
        Map<BlockType, List<Pattern>> table = new LinkedHashMap<>();
        table.put(BlockType.COMMENT, patterns("^//", "^#", "^comment:"));
        table.put(BlockType.START, patterns("^start$", "^begin$", "^initialize$"));
        table.put(BlockType.END, patterns("^end$", "^stop$", "^exit$"));
        table.put(BlockType.CONNECTOR, List.of(
                CONDITIONAL_END_MARKER,
                LOOP_END_MARKER,
                Pattern.compile("^end\\s*(?:function|procedure)\\b"),
                Pattern.compile("^goto\\s+"),
                Pattern.compile("^jump\\s+"),
                Pattern.compile("^continue$"),
                Pattern.compile("^break$")));
        table.put(BlockType.FUNCTION_DEF, patterns("^(?:function|procedure|def)\\s+\\w+\\s*\\("));
        table.put(BlockType.ELSE_IF, patterns("^else\\s*if\\b", "^elif\\b"));
        table.put(BlockType.CONDITION, patterns("^if\\s+", "^else$", "^otherwise$"));
        table.put(BlockType.SWITCH, patterns("^switch\\b", "^select\\s+"));
        table.put(BlockType.CASE, patterns("^case\\b", "^default\\b"));
        table.put(BlockType.RETURN, patterns("^return\\b"));
        table.put(BlockType.LOOP, patterns("^while\\s+", "^for\\s+", "^foreach\\s+", "^do\\b", "^repeat\\b", "^loop\\b"));
        table.put(BlockType.INPUT, patterns("^input\\s+", "^read\\s+", "^get\\s+", "^scan\\b", "^enter\\s+"));
        table.put(BlockType.OUTPUT, patterns("^output\\s+", "^print\\s+", "^display\\s+", "^show\\s+", "^write\\b"));
        table.put(BlockType.FUNCTION, patterns("^call\\s+", "^invoke\\s+", "^execute\\s+", "^function\\s+", "^procedure\\s+"));
        return Collections.unmodifiableMap(table);
    }

    private static List<Pattern> patterns(String... regexes) {
        Pattern[] compiled = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            compiled[i] = Pattern.compile(regexes[i]);
        }
        return List.of(compiled);
    }
}
