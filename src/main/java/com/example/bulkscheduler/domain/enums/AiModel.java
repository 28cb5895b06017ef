package com.example.bulkscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * AI model the generation collaborator should use for a job.
 */
@Getter
@RequiredArgsConstructor
public enum AiModel {

    CLAUDE("claude", "Claude"),

    CHATGPT("chatgpt", "ChatGPT");

    /**
     * Wire value understood by the generation service
     */
    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Resolve a model from its wire code or enum name, case-insensitive.
     * "gpt" is accepted as an alias for ChatGPT.
     */
    @JsonCreator
    public static AiModel fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        var normalized = value.trim();
        for (var model : values()) {
            if (model.code.equalsIgnoreCase(normalized) || model.name().equalsIgnoreCase(normalized)) {
                return model;
            }
        }
        if ("gpt".equalsIgnoreCase(normalized)) {
            return CHATGPT;
        }
        throw new IllegalArgumentException("Unknown AI model: " + value);
    }
}
