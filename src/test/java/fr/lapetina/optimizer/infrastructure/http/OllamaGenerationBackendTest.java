package fr.lapetina.optimizer.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationBackendException;
import fr.lapetina.optimizer.domain.backend.GenerationOptions;
import fr.lapetina.optimizer.domain.backend.GenerationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OllamaGenerationBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicInteger statusCode = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>();

    private HttpServer server;
    private OllamaGenerationBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        backend = newBackend(3);
    }

    @AfterEach
    void tearDown() {
        backend.close();
        server.stop(0);
    }

    private OllamaGenerationBackend newBackend(int failureThreshold) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        CircuitBreaker breaker = new CircuitBreaker("ollama:llama3", failureThreshold, Duration.ofMinutes(1));
        return new OllamaGenerationBackend(baseUrl, "llama3", Duration.ofSeconds(2), breaker, Clock.systemUTC());
    }

    private GenerationBackendException failureOf(OllamaGenerationBackend target) {
        ExecutionException error = catchThrowableOfType(
                () -> target.generate("prompt", new GenerationOptions(50, 0.2)).get(5, TimeUnit.SECONDS),
                ExecutionException.class);
        assertThat(error.getCause()).isInstanceOf(GenerationBackendException.class);
        return (GenerationBackendException) error.getCause();
    }

    @Test
    @DisplayName("should post a non-streaming generate request and parse the answer")
    void shouldGenerate() throws Exception {
        responseBody.set("{\"response\":\"A short summary.\",\"prompt_eval_count\":12,"
                + "\"eval_count\":30,\"done\":true,\"done_reason\":\"stop\"}");

        GenerationResult result = backend.generate("Summarize this", new GenerationOptions(256, 0.3))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.text()).isEqualTo("A short summary.");
        assertThat(result.tokensUsed()).isEqualTo(42);
        assertThat(result.finishReason()).isEqualTo(FinishReason.STOP);

        JsonNode sent = objectMapper.readTree(lastRequestBody.get());
        assertThat(lastPath.get()).isEqualTo("/api/generate");
        assertThat(sent.path("model").asText()).isEqualTo("llama3");
        assertThat(sent.path("prompt").asText()).isEqualTo("Summarize this");
        assertThat(sent.path("stream").asBoolean(true)).isFalse();
        assertThat(sent.path("options").path("num_predict").asInt()).isEqualTo(256);
        assertThat(sent.path("options").path("temperature").asDouble()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("should map a length stop to a truncated result")
    void shouldMapLengthStop() throws Exception {
        responseBody.set("{\"response\":\"cut\",\"eval_count\":50,\"done_reason\":\"length\"}");

        GenerationResult result = backend.generate("p", new GenerationOptions(50, 0.2)).get(5, TimeUnit.SECONDS);

        assertThat(result.finishReason()).isEqualTo(FinishReason.LENGTH);
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    @DisplayName("should treat server errors as transient")
    void shouldTreatServerErrorsAsTransient() {
        statusCode.set(503);
        responseBody.set("{\"error\":\"model is loading\"}");

        GenerationBackendException failure = failureOf(backend);

        assertThat(failure.isTransient()).isTrue();
        assertThat(failure.getStatusCode()).isEqualTo(503);
        assertThat(failure.getMessage()).contains("model is loading");
        assertThat(backend.getCircuitBreaker().getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("should treat client errors as permanent and leave the breaker alone")
    void shouldTreatClientErrorsAsPermanent() {
        statusCode.set(404);
        responseBody.set("{\"error\":\"model 'llama3' not found\"}");

        GenerationBackendException failure = failureOf(backend);

        assertThat(failure.isTransient()).isFalse();
        assertThat(failure.getStatusCode()).isEqualTo(404);
        assertThat(backend.getCircuitBreaker().getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should treat an unparsable answer as transient")
    void shouldTreatMalformedAnswerAsTransient() {
        responseBody.set("not json at all");

        GenerationBackendException failure = failureOf(backend);

        assertThat(failure.isTransient()).isTrue();
    }

    @Test
    @DisplayName("should fail fast once the circuit is open")
    void shouldFailFastWhenOpen() {
        backend.close();
        backend = newBackend(1);
        statusCode.set(500);
        responseBody.set("{\"error\":\"boom\"}");
        failureOf(backend);

        GenerationBackendException failure = failureOf(backend);

        assertThat(backend.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(failure.isTransient()).isTrue();
        assertThat(failure.getMessage()).contains("Circuit breaker is open");
    }

    @Test
    @DisplayName("should report connection failures as transient")
    void shouldReportConnectionFailure() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        OllamaGenerationBackend unreachable = new OllamaGenerationBackend("http://127.0.0.1:" + closedPort, "llama3",
                Duration.ofSeconds(2), new CircuitBreaker("ollama:llama3", 3, Duration.ofMinutes(1)), Clock.systemUTC());

        GenerationBackendException failure = failureOf(unreachable);

        assertThat(failure.isTransient()).isTrue();
        assertThat(failure.getStatusCode()).isEqualTo(-1);
    }

    @Test
    @DisplayName("should abandon the exchange once the caller's time is up")
    void shouldApplyRequestTimeout() throws IOException {
        HttpServer slowServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        slowServer.createContext("/api/generate", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        ExecutorService handlerPool = Executors.newCachedThreadPool();
        slowServer.setExecutor(handlerPool);
        slowServer.start();
        OllamaGenerationBackend slow = new OllamaGenerationBackend(
                "http://127.0.0.1:" + slowServer.getAddress().getPort(), "llama3", Duration.ofSeconds(2),
                new CircuitBreaker("ollama:llama3", 3, Duration.ofMinutes(1)), Clock.systemUTC());
        try {
            long start = System.nanoTime();
            ExecutionException error = catchThrowableOfType(
                    () -> slow.generate("prompt", new GenerationOptions(50, 0.2, Duration.ofMillis(200)))
                            .get(5, TimeUnit.SECONDS),
                    ExecutionException.class);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(error.getCause()).isInstanceOf(GenerationBackendException.class);
            assertThat(((GenerationBackendException) error.getCause()).isTransient()).isTrue();
            assertThat(elapsedMs).isLessThan(2500);
        } finally {
            slow.close();
            handlerPool.shutdownNow();
            slowServer.stop(0);
        }
    }

    @Test
    @DisplayName("should name itself after the model")
    void shouldExposeName() {
        assertThat(backend.getName()).isEqualTo("ollama:llama3");
    }
}
