package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexer for the pseudocode DSL: turns raw text into an ordered sequence of typed
 * {@link Block}s.
 *
 * <p>Indentation is tracked with a stack of seen widths. A deeper line pushes its width
 * and nests one level further; a shallower line pops until its width is no longer below
 * the top. Lines starting with {@code else}, {@code case} or {@code default} share the
 * level of the construct they continue instead of nesting under it.</p>
 *
 * <p>The classifier never fails: unknown lines become {@code process} blocks and odd
 * indentation is clamped at level 0. Checking the result is the validator's job.</p>
 */
public final class LineClassifier {

    public static final String TERMINATOR = "::";
    private static final int TAB_WIDTH = 4;

    private LineClassifier() {
        // utility class
    }

    public static List<Block> parse(String source) {
        if (source == null || source.isEmpty()) return Collections.emptyList();
        return parse(Arrays.asList(source.split("\r?\n")));
    }

    public static List<Block> parse(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        IndentState indent = new IndentState();

        for (String line : lines) {
            if (line == null || line.trim().isEmpty()) continue;

            int width = indentWidth(line);
            String content = stripTerminator(line);
            if (content.isEmpty()) continue;

            BlockType type = detectBlockType(content);
            boolean closing = isClosing(content);
            int level = indent.levelFor(width, content, type, closing);

            blocks.add(new Block(content, level, type, closing));
        }

        return Collections.unmodifiableList(blocks);
    }

    public static BlockType detectBlockType(String content) {
        String normalized = normalize(content);
        for (Map.Entry<BlockType, List<Pattern>> entry : KeywordPatterns.table().entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(normalized).find()) {
                    return entry.getKey();
                }
            }
        }
        return BlockType.PROCESS;
    }

    public static boolean isClosing(String content) {
        return KeywordPatterns.CLOSING.matcher(normalize(content)).find();
    }

    /** Trimmed line content without the optional trailing {@code ::} terminator. */
    public static String stripTerminator(String line) {
        if (line == null) return "";
        String trimmed = line.trim();
        if (trimmed.endsWith(TERMINATOR)) {
            trimmed = trimmed.substring(0, trimmed.length() - TERMINATOR.length()).trim();
        }
        return trimmed;
    }

    public static int indentWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    static String normalize(String content) {
        return content.trim().toLowerCase(Locale.ROOT);
    }

    /** Width stack plus the {@code if}/{@code switch} lines still open, with their levels. */
    private static final class IndentState {
        private final Deque<Integer> widths = new ArrayDeque<>();
        private final Deque<int[]> openers = new ArrayDeque<>(); // {width, level}

        IndentState() {
            widths.push(0);
        }

        int levelFor(int width, String content, BlockType type, boolean closing) {
            boolean continuation = KeywordPatterns.BRANCH_CONTINUATION.matcher(normalize(content)).find();
            int level;

            if (continuation) {
                while (!openers.isEmpty() && openers.peek()[0] > width) {
                    openers.pop();
                }
                if (!openers.isEmpty()) {
                    int[] opener = openers.peek();
                    while (widths.size() > opener[1] + 1) {
                        widths.pop();
                    }
                    level = opener[1];
                } else {
                    level = Math.max(0, applyWidth(width) - 1);
                }
            } else {
                level = applyWidth(width);
                while (!openers.isEmpty() && openers.peek()[0] >= width) {
                    openers.pop();
                }
            }

            if ((type == BlockType.CONDITION && !closing) || type == BlockType.SWITCH) {
                openers.push(new int[]{width, level});
            }
            return level;
        }

        private int applyWidth(int width) {
            if (width > widths.peek()) {
                widths.push(width);
            } else {
                while (widths.size() > 1 && width < widths.peek()) {
                    widths.pop();
                }
            }
            return widths.size() - 1;
        }
    }
}
