package com.example.RagChat.config;

import com.example.RagChat.service.LlmClient;
import com.example.RagChat.service.SpringAiLlmClient;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.Map;

@Configuration
public class AiConfig {

    static final String SYSTEM_PROMPT = """
            You are a helpful AI assistant. Use the provided context and conversation history to answer.
            If the context does not contain the answer, say that you don't know instead of making one up.
            Cite the source documents when possible.""";

    /**
     * DeepSeek is the default ChatClient.
     * Only created when a DeepSeekChatModel bean exists, so a missing DeepSeek key does not break startup.
     */
    @Bean
    @Primary
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
    }

    /**
     * OpenAI ChatClient as an alternative.
     */
    @Bean
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
    }

    /**
     * If no ChatClient beans are registered, build one from DeepSeek when available, otherwise OpenAI.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    @Bean
    @ConditionalOnMissingBean(LlmClient.class)
    public LlmClient llmClient(Map<String, ChatClient> chatClients, RagChatProperties properties) {
        return new SpringAiLlmClient(chatClients, properties.getGeneration().getModel());
    }
}
