package fr.lapetina.optimizer.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationBackend;
import fr.lapetina.optimizer.domain.backend.GenerationBackendException;
import fr.lapetina.optimizer.domain.backend.GenerationOptions;
import fr.lapetina.optimizer.domain.backend.GenerationResult;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Generation backend calling an Ollama server's {@code /api/generate} endpoint.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O, with a circuit breaker in front.
 * Connection failures and 5xx answers are transient; 4xx answers are not.
 */
public class OllamaGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationBackend.class);

    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final URI generateUri;
    private final String model;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public OllamaGenerationBackend(String baseUrl, String model, Duration connectTimeout,
                                   CircuitBreaker circuitBreaker, Clock clock) {
        this.generateUri = URI.create(baseUrl.endsWith("/") ? baseUrl + "api/generate" : baseUrl + "/api/generate");
        this.model = model;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static OllamaGenerationBackend fromConfig(OptimizerConfig.BackendConfig config, Clock clock) {
        CircuitBreaker breaker = new CircuitBreaker(
                "ollama:" + config.getModel(),
                config.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(config.getCircuitBreakerRecoveryMs()),
                1,
                clock
        );
        return new OllamaGenerationBackend(config.getBaseUrl(), config.getModel(),
                Duration.ofMillis(config.getConnectTimeoutMs()), breaker, clock);
    }

    @Override
    public String getName() {
        return "ollama:" + model;
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, GenerationOptions options) {
        if (!circuitBreaker.allowRequest()) {
            log.warn("Generation blocked by circuit breaker: backend={}", getName());
            return CompletableFuture.failedFuture(
                    new GenerationBackendException("Circuit breaker is open for backend: " + getName(), true));
        }

        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(generateUri)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(prompt, options)));
            if (options.timeout() != null) {
                // The exchange is abandoned at the caller's deadline; HttpClient rejects a zero timeout
                builder.timeout(options.timeout().compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : options.timeout());
            }
            request = builder.build();
        } catch (JsonProcessingException e) {
            log.error("Failed to build generation request: backend={}", getName(), e);
            return CompletableFuture.failedFuture(
                    new GenerationBackendException("Failed to build request: " + e.getMessage(), false, -1, e));
        }

        Instant startTime = clock.instant();
        log.debug("Sending generation request: backend={}, uri={}, maxTokens={}, timeout={}",
                getName(), generateUri, options.maxTokens(), options.timeout());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw translateFailure(error);
                    }
                    return handleResponse(response, startTime);
                });
    }

    private String buildRequestBody(String prompt, GenerationOptions options) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of(
                "num_predict", options.maxTokens(),
                "temperature", options.temperature()
        ));
        return objectMapper.writeValueAsString(body);
    }

    private GenerationResult handleResponse(HttpResponse<String> response, Instant startTime) {
        long latencyMs = Duration.between(startTime, clock.instant()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            boolean transientFailure = statusCode >= 500;
            if (transientFailure) {
                circuitBreaker.recordFailure();
            }
            String message = "HTTP " + statusCode + ": " + extractError(response.body());
            log.warn("Generation failed with HTTP error: backend={}, status={}, latencyMs={}",
                    getName(), statusCode, latencyMs);
            throw new GenerationBackendException(message, transientFailure, statusCode, null);
        }

        try {
            JsonNode json = objectMapper.readTree(response.body());
            String text = json.path("response").asText("");
            int tokens = json.path("prompt_eval_count").asInt(0) + json.path("eval_count").asInt(0);
            FinishReason finishReason = FinishReason.fromWire(json.path("done_reason").asText(null));
            circuitBreaker.recordSuccess();
            log.debug("Generation succeeded: backend={}, tokens={}, finishReason={}, latencyMs={}",
                    getName(), tokens, finishReason, latencyMs);
            return new GenerationResult(text, tokens, finishReason);
        } catch (JsonProcessingException e) {
            circuitBreaker.recordFailure();
            log.error("Failed to parse generation response: backend={}", getName(), e);
            throw new GenerationBackendException("Malformed response: " + e.getOriginalMessage(), true, statusCode, e);
        }
    }

    private String extractError(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json.hasNonNull("error")) {
                return json.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: backend={}", getName());
        }
        return body == null ? "" : body;
    }

    private GenerationBackendException translateFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof GenerationBackendException) {
            return (GenerationBackendException) cause;
        }
        circuitBreaker.recordFailure();
        boolean transientFailure = cause instanceof IOException;
        log.error("Generation request failed: backend={}, errorType={}, error={}",
                getName(), cause.getClass().getSimpleName(), cause.getMessage());
        return new GenerationBackendException(
                "Backend call failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                transientFailure, -1, cause);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
