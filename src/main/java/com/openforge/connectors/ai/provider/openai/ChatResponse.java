package com.openforge.connectors.ai.provider.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 *
 * The message stays a tree: OpenAI sends tool-call arguments as a JSON
 * string, some compatible servers as an object, and the tool format copes
 * with both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** First choice; null when the provider returned none. */
    public Choice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Choice(
            int index,
            JsonNode message,
            String finishReason
    ) {

        public String content() {
            JsonNode content = message == null ? null : message.get("content");
            return content == null || content.isNull() ? "" : content.asText();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
