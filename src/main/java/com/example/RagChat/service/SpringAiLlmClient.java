package com.example.RagChat.service;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link LlmClient} backed by a Spring AI {@link ChatClient}.
 */
public class SpringAiLlmClient implements LlmClient {

    public static final String DEFAULT_MODEL = "deepseek";

    private final ChatClient chatClient;

    public SpringAiLlmClient(Map<String, ChatClient> chatClients, String model) {
        this.chatClient = resolveClient(chatClients, model);
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        String content = chatClient.prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build())
                .call()
                .content();
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("LLM returned an empty answer");
        }
        return content;
    }

    /**
     * Resolve ChatClient bean based on requested model identifier.
     * Supported lookup keys:
     *  - "<model>ChatClient"
     *  - "<model>"
     * Fallback:
     *  - default model "ChatClient"
     *  - any available ChatClient if nothing matches
     */
    static ChatClient resolveClient(Map<String, ChatClient> chatClients, String model) {
        String key = Optional.ofNullable(model)
                .filter(m -> !m.isBlank())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .orElse(DEFAULT_MODEL);
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get(DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }
}
