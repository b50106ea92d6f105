package fr.lapetina.optimizer.domain.backend;

import java.util.concurrent.CompletableFuture;

/**
 * External text-generation provider, invoked only on a cache miss.
 *
 * Implementations must be thread-safe. The returned future should honour
 * {@link CompletableFuture#cancel(boolean)} on a best-effort basis; the optimizer
 * cancels it when the request deadline passes. Failures complete the future
 * exceptionally, preferably with a {@link GenerationBackendException}.
 */
public interface GenerationBackend extends AutoCloseable {

    /**
     * Returns the backend name for logging and metrics.
     */
    String getName();

    /**
     * Generates text for the prompt.
     *
     * @param prompt  Prompt text, already tuned by the optimizer
     * @param options Generation parameters
     * @return future completing with the generated text
     */
    CompletableFuture<GenerationResult> generate(String prompt, GenerationOptions options);

    @Override
    default void close() {
        // Default no-op
    }
}
