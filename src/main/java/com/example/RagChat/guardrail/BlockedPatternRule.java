package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-insensitive regex deny-list. At MEDIUM severity the matches are stripped.
 */
public class BlockedPatternRule extends AbstractGuardrailRule {

    public static final String ID = "blocked-pattern";

    private final List<Pattern> patterns;

    public BlockedPatternRule(List<String> regexes, Severity severity, Set<Direction> directions, FailureMode failureMode) {
        super(ID, ViolationKind.BLOCKED_PATTERN, severity, directions, failureMode);
        this.patterns = regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    @Override
    public Optional<RuleFinding> evaluate(String text) {
        String stripped = text;
        int hits = 0;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(stripped);
            if (matcher.find()) {
                hits++;
                stripped = strip(matcher.reset(), stripped);
            }
        }
        if (hits == 0) {
            return Optional.empty();
        }
        return Optional.of(RuleFinding.sanitized(hits + " blocked pattern(s) matched", stripped));
    }

    /**
     * Removes every match together with the spaces or tabs around it. Line breaks elsewhere are untouched;
     * a match in the middle of a line leaves a single space behind.
     */
    static String strip(Matcher matcher, String text) {
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            if (matcher.end() == matcher.start() || matcher.end() <= last) {
                continue;
            }
            int left = Math.max(matcher.start(), last);
            while (left > last && isInlineSpace(text.charAt(left - 1))) {
                left--;
            }
            int right = matcher.end();
            while (right < text.length() && isInlineSpace(text.charAt(right))) {
                right++;
            }
            out.append(text, last, left);
            boolean midLine = left > 0 && right < text.length()
                    && !isLineBreak(text.charAt(left - 1)) && !isLineBreak(text.charAt(right));
            if (midLine && (left < matcher.start() || right > matcher.end())) {
                out.append(' ');
            }
            last = right;
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    private static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
