package com.example.RagChat.service;

/**
 * Text generation provider. Implementations throw on any provider failure;
 * retries and deadlines are applied by the caller.
 */
@FunctionalInterface
public interface LlmClient {

    String generate(String prompt, double temperature, int maxTokens);
}
