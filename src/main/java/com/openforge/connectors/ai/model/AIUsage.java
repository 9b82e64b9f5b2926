package com.openforge.connectors.ai.model;

/** Token accounting normalized across providers. */
public record AIUsage(
        int inputTokens,
        int outputTokens,
        int totalTokens
) {

    public static AIUsage empty() {
        return new AIUsage(0, 0, 0);
    }

    public static AIUsage of(int inputTokens, int outputTokens) {
        return new AIUsage(inputTokens, outputTokens, inputTokens + outputTokens);
    }

    public AIUsage plus(AIUsage other) {
        return new AIUsage(inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                totalTokens + other.totalTokens);
    }
}
