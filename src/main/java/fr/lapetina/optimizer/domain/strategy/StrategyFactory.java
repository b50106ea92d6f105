package fr.lapetina.optimizer.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves the {@code loadBalancer.strategy} configuration value to a fresh strategy instance.
 * Names are matched case-insensitively, surrounding blanks ignored.
 */
public final class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    public static final String DEFAULT_STRATEGY = "least-loaded";

    private static final Map<String, Supplier<WorkerSelectionStrategy>> STRATEGIES = Map.of(
            "least-loaded", LeastLoadedStrategy::new,
            "round-robin", RoundRobinStrategy::new
    );

    private StrategyFactory() {
    }

    public static Optional<WorkerSelectionStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<WorkerSelectionStrategy> supplier = STRATEGIES.get(name.trim().toLowerCase(Locale.ROOT));
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    /**
     * Like {@link #create(String)}, but unknown or missing names yield least-loaded.
     */
    public static WorkerSelectionStrategy createOrDefault(String name) {
        Optional<WorkerSelectionStrategy> strategy = create(name);
        if (strategy.isEmpty()) {
            log.warn("Unknown worker selection strategy, using default: requested={}, default={}",
                    name, DEFAULT_STRATEGY);
            return new LeastLoadedStrategy();
        }
        return strategy.get();
    }

    public static Set<String> names() {
        return STRATEGIES.keySet();
    }
}
