package fr.lapetina.optimizer;

import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationBackend;
import fr.lapetina.optimizer.domain.backend.GenerationOptions;
import fr.lapetina.optimizer.domain.backend.GenerationResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Scriptable backend recording every call it receives.
 */
public final class StubGenerationBackend implements GenerationBackend {

    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<GenerationOptions> options = new CopyOnWriteArrayList<>();
    private volatile BiFunction<String, GenerationOptions, CompletableFuture<GenerationResult>> behaviour;

    public StubGenerationBackend() {
        answering("generated answer");
    }

    public StubGenerationBackend answering(String text) {
        return respondingWith((prompt, opts) ->
                CompletableFuture.completedFuture(new GenerationResult(text, 25, FinishReason.STOP)));
    }

    public StubGenerationBackend respondingWith(
            BiFunction<String, GenerationOptions, CompletableFuture<GenerationResult>> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, GenerationOptions generationOptions) {
        prompts.add(prompt);
        options.add(generationOptions);
        return behaviour.apply(prompt, generationOptions);
    }

    public int callCount() {
        return prompts.size();
    }

    public String lastPrompt() {
        return prompts.get(prompts.size() - 1);
    }

    public GenerationOptions lastOptions() {
        return options.get(options.size() - 1);
    }
}
