package fr.lapetina.optimizer;

import fr.lapetina.optimizer.domain.backend.GenerationOptions;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;

import java.util.regex.Pattern;

/**
 * Cheap request tuning applied before a backend call.
 *
 * Whitespace runs in the prompt collapse to a single space, an oversized token budget is
 * capped and a high temperature is lowered. Each rule only fires above its threshold.
 */
public final class PromptTuner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int tokenLimitThreshold;
    private final int tokenLimitCap;
    private final double temperatureThreshold;
    private final double temperatureCap;

    public PromptTuner(int tokenLimitThreshold, int tokenLimitCap, double temperatureThreshold, double temperatureCap) {
        this.tokenLimitThreshold = tokenLimitThreshold;
        this.tokenLimitCap = tokenLimitCap;
        this.temperatureThreshold = temperatureThreshold;
        this.temperatureCap = temperatureCap;
    }

    public static PromptTuner fromConfig(OptimizerConfig.RequestConfig config) {
        return new PromptTuner(config.getTokenLimitThreshold(), config.getTokenLimitCap(),
                config.getTemperatureThreshold(), config.getTemperatureCap());
    }

    public Tuned tune(String prompt, int maxTokens, double temperature) {
        String tunedPrompt = WHITESPACE.matcher(prompt.strip()).replaceAll(" ");
        int tunedMaxTokens = maxTokens > tokenLimitThreshold ? Math.min(maxTokens, tokenLimitCap) : maxTokens;
        double tunedTemperature = temperature > temperatureThreshold ? Math.min(temperature, temperatureCap) : temperature;

        boolean changed = !tunedPrompt.equals(prompt)
                || tunedMaxTokens != maxTokens
                || tunedTemperature != temperature;
        return new Tuned(tunedPrompt, new GenerationOptions(tunedMaxTokens, tunedTemperature), changed);
    }

    /**
     * @param changed true if any rule altered the prompt or the options
     */
    public record Tuned(String prompt, GenerationOptions options, boolean changed) {
    }
}
