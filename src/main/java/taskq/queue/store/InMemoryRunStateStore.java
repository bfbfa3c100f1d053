package taskq.queue.store;

import taskq.queue.model.RunState;
import taskq.queue.repository.RunStateStore;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local run-state marker, for tests and embedded use.
 */
public class InMemoryRunStateStore implements RunStateStore {

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.STOPPED);

    @Override
    public RunState get() {
        return state.get();
    }

    @Override
    public void set(RunState newState) {
        state.set(newState);
    }
}
