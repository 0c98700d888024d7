package com.example.RagChat.session;

import com.example.RagChat.model.Message;
import com.example.RagChat.model.Role;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders conversation history for the LLM prompt.
 *
 * Truncation rule: walk from the newest message backwards and keep whole messages while both
 * {@code maxMessages} and {@code maxChars} allow. If even the newest message does not fit,
 * it is cut to {@code maxChars} so the model still sees the latest turn.
 */
public final class HistoryFormatter {

    public static final String EMPTY_HISTORY = "(no prior conversation)";
    private static final String ELLIPSIS = "...";

    private HistoryFormatter() {
    }

    public static String format(List<Message> messages, int maxMessages, int maxChars) {
        if (messages == null || messages.isEmpty() || maxMessages <= 0 || maxChars <= 0) {
            return EMPTY_HISTORY;
        }

        Deque<String> window = new ArrayDeque<>();
        int used = 0;
        for (int i = messages.size() - 1; i >= 0 && window.size() < maxMessages; i--) {
            String line = render(messages.get(i));
            int cost = line.length() + (window.isEmpty() ? 0 : 1);
            if (used + cost > maxChars) {
                if (window.isEmpty()) {
                    window.addFirst(cut(line, maxChars));
                }
                break;
            }
            window.addFirst(line);
            used += cost;
        }
        return String.join("\n", window);
    }

    static String render(Message message) {
        String label = message.role() == Role.USER ? "User" : "Assistant";
        return label + ": " + message.content();
    }

    private static String cut(String line, int maxChars) {
        if (maxChars <= ELLIPSIS.length()) {
            return line.substring(0, maxChars);
        }
        return line.substring(0, maxChars - ELLIPSIS.length()) + ELLIPSIS;
    }
}
