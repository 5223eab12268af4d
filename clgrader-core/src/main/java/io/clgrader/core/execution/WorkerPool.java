package io.clgrader.core.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/// Bounded pool on which every process-launching unit runs.
///
/// Results come back in submission order regardless of completion order, which is what
/// keeps the result tree in declaration order.
///
/// ### Deadlock freedom
/// Units submitted here must never wait on other units of the same pool. Coordination
/// (waiting for a group's cases) happens on coordinator threads outside this pool, so a
/// pool of size 1 still makes progress.
///
/// @implNote The executor service is owned by the
/// {@link io.clgrader.core.GraderEnvironment}, which shuts it down.
public class WorkerPool {

    private final ExecutorService executorService;

    public WorkerPool(ExecutorService executorService) {
        this.executorService = executorService;
    }

    /// Runs one unit and waits for it.
    ///
    /// @param unit work to run, not null
    /// @return the unit's result
    /// @throws InterruptedException if interrupted while waiting; the unit is cancelled
    /// @throws ExecutionException if the unit threw
    public <T> T run(Callable<T> unit) throws InterruptedException, ExecutionException {
        return runAll(List.of(unit)).get(0);
    }

    /// Runs units concurrently and collects their results by index.
    ///
    /// @param units work to run, not null
    /// @return results in the order of `units`, never null
    /// @throws InterruptedException if interrupted while waiting; every unit is cancelled
    /// @throws ExecutionException for the first unit, in index order, that threw
    public <T> List<T> runAll(List<? extends Callable<T>> units)
            throws InterruptedException, ExecutionException {
        List<Future<T>> futures = new ArrayList<>(units.size());
        try {
            for (Callable<T> unit : units) {
                futures.add(executorService.submit(unit));
            }
            List<T> results = new ArrayList<>(units.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException | ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
    }
}
