package org.dxworks.flowframe.analyzer.recursion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds invocations of a named function in a line. Three calling conventions are
 * recognised: {@code call name}, {@code name(...)} and {@code invoke|execute name}.
 * A bare mention of the name without a keyword or parentheses is not a call.
 */
public final class CallSiteParser {

    private CallSiteParser() {
        // utility class
    }

    public static List<CallSite> findCalls(String line, String calleeName) {
        if (line == null || calleeName == null || calleeName.isEmpty()) return Collections.emptyList();

        Pattern pattern = Pattern.compile(
                "(?i)(?:\\b(call|invoke|execute)\\s+)?\\b(" + Pattern.quote(calleeName) + ")\\b(\\s*\\()?");
        Matcher m = pattern.matcher(line);
        List<CallSite> calls = new ArrayList<>();

        while (m.find()) {
            boolean keyword = m.group(1) != null;
            boolean parenthesized = m.group(3) != null;
            if (!keyword && !parenthesized) continue;

            int nameStart = m.start(2);
            if (!parenthesized) {
                calls.add(new CallSite(m.group(2), m.group(2), Collections.emptyList(), m.start(), m.end(2)));
                continue;
            }

            int open = m.end() - 1;
            int close = CallTextUtils.findMatchingParen(line, open);
            String args;
            int end;
            if (close > open) {
                args = line.substring(open + 1, close);
                end = close + 1;
            } else {
                args = line.substring(open + 1);
                end = line.length();
            }
            calls.add(new CallSite(m.group(2), line.substring(nameStart, end).trim(),
                    CallTextUtils.splitArguments(args), m.start(), end));
            // continue right after the opening paren so calls nested in the arguments are found too
            m.region(open + 1, line.length());
        }
        return calls;
    }

    public static boolean invokes(String line, String calleeName) {
        return !findCalls(line, calleeName).isEmpty();
    }
}
