package fr.lapetina.optimizer.infrastructure.config;

/**
 * Listener notified after a configuration has been loaded and validated.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig previous configuration, null on first load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(OptimizerConfig oldConfig, OptimizerConfig newConfig);
}
