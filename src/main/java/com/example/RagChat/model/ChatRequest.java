package com.example.RagChat.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ChatRequest(
        @NotBlank String userId,
        @NotNull String query
) {
}
