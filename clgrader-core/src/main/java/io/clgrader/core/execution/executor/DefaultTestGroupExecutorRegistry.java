package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.TestGroup;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Registry pre-populated with the unit, integration and performance executors.
///
/// @implNote **Thread-safe**.
public class DefaultTestGroupExecutorRegistry implements TestGroupExecutorRegistry {

    private final Map<Class<? extends TestGroup>, TestGroupExecutor<?>> executors =
            new ConcurrentHashMap<>();

    public DefaultTestGroupExecutorRegistry() {
        register(new UnitTestExecutor());
        register(new IntegrationTestExecutor());
        register(new PerformanceTestExecutor());
    }

    @Override
    public <T extends TestGroup> Optional<TestGroupExecutor<T>> getExecutor(Class<T> groupType) {
        return Optional.ofNullable((TestGroupExecutor<T>) executors.get(groupType));
    }

    @Override
    public <T extends TestGroup> void register(TestGroupExecutor<T> executor) {
        executors.put(executor.getGroupType(), executor);
    }
}
