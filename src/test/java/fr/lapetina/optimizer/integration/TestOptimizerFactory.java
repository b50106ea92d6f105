package fr.lapetina.optimizer.integration;

import fr.lapetina.optimizer.OptimizerFactory;
import fr.lapetina.optimizer.StubGenerationBackend;

/**
 * Test extension of OptimizerFactory wired to a stub generation backend.
 */
public final class TestOptimizerFactory extends OptimizerFactory {

    private final StubGenerationBackend stubBackend;

    private TestOptimizerFactory(String configPath, StubGenerationBackend stubBackend) {
        super(configPath, stubBackend);
        this.stubBackend = stubBackend;
    }

    /**
     * Creates and starts a test factory from the default test configuration.
     */
    public static TestOptimizerFactory create() {
        return create("test-optimizer.yaml");
    }

    /**
     * Creates and starts a test factory from a custom configuration path.
     */
    public static TestOptimizerFactory create(String configPath) {
        TestOptimizerFactory factory = new TestOptimizerFactory(configPath, new StubGenerationBackend());
        factory.start();
        return factory;
    }

    public StubGenerationBackend getStubBackend() {
        return stubBackend;
    }
}
