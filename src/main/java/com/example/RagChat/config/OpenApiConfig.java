package com.example.RagChat.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "RagChat API",
                version = "v1",
                description = "Conversational retrieval with guardrails, sessions and document ingestion"
        )
)
public class OpenApiConfig {
}
