package fr.lapetina.optimizer.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A generation request submitted to the optimizer.
 * Immutable and thread-safe.
 *
 * <p>{@code analysisType} and {@code content} form the cache key; {@code prompt}
 * is what is sent to the backend and defaults to {@code content}.
 */
public record OptimizationRequest(
        String requestId,
        String sessionId,
        String preferredWorkerId,
        String analysisType,
        String content,
        String prompt,
        int maxTokens,
        double temperature,
        Set<String> requiredTags,
        Duration timeout
) {
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public OptimizationRequest {
        Objects.requireNonNull(analysisType, "Analysis type is required");
        Objects.requireNonNull(content, "Content is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (sessionId == null) {
            sessionId = "session-" + requestId;
        }
        if (prompt == null) {
            prompt = content;
        }
        requiredTags = requiredTags != null ? Set.copyOf(requiredTags) : Set.of();
    }

    /**
     * Creates a request keyed by type and content, prompting with the content itself.
     */
    public static OptimizationRequest of(String analysisType, String content) {
        return builder().analysisType(analysisType).content(content).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String sessionId;
        private String preferredWorkerId;
        private String analysisType;
        private String content;
        private String prompt;
        private int maxTokens = DEFAULT_MAX_TOKENS;
        private double temperature = DEFAULT_TEMPERATURE;
        private Set<String> requiredTags;
        private Duration timeout;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder preferredWorkerId(String preferredWorkerId) {
            this.preferredWorkerId = preferredWorkerId;
            return this;
        }

        public Builder analysisType(String analysisType) {
            this.analysisType = analysisType;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder requiredTags(Set<String> requiredTags) {
            this.requiredTags = requiredTags;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OptimizationRequest build() {
            return new OptimizationRequest(
                    requestId, sessionId, preferredWorkerId, analysisType, content,
                    prompt, maxTokens, temperature, requiredTags, timeout
            );
        }
    }
}
