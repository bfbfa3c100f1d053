package taskq.queue.scheduler;

import taskq.queue.model.ControlResult;
import taskq.queue.model.RunState;
import taskq.queue.repository.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * start / stop / status over the persisted run-state marker.
 *
 * {@code stop} and {@code status} only touch the marker, so they work from a
 * different process than the one running the dispatcher.
 */
public class SchedulerControl {

    private static final Logger log = LoggerFactory.getLogger(SchedulerControl.class);

    private final RunStateStore runState;
    private final Supplier<Dispatcher> dispatcherFactory;

    private volatile Dispatcher current;

    /**
     * @param dispatcherFactory builds a fresh dispatcher; building it opens the
     *                          store and creates the schema if absent
     */
    public SchedulerControl(RunStateStore runState, Supplier<Dispatcher> dispatcherFactory) {
        this.runState = runState;
        this.dispatcherFactory = dispatcherFactory;
    }

    /**
     * Enter the dispatcher loop. Blocks until the loop has drained.
     */
    public ControlResult start() {
        if (runState.get() == RunState.RUNNING) {
            log.info("Scheduler is already running");
            return ControlResult.ALREADY_RUNNING;
        }

        Dispatcher dispatcher = dispatcherFactory.get();
        current = dispatcher;
        try {
            runState.set(RunState.RUNNING);
            log.info("Scheduler started");
            dispatcher.run();
        } finally {
            current = null;
        }
        log.info("Scheduler stopped");
        return ControlResult.STARTED;
    }

    /**
     * Ask a running dispatcher to exit. Cooperative: the loop notices on its
     * next marker check and lets in-flight tasks finish.
     */
    public ControlResult stop() {
        if (runState.get() != RunState.RUNNING) {
            log.info("Scheduler is not running");
            return ControlResult.NOT_RUNNING;
        }
        runState.set(RunState.STOPPED);
        log.info("Stop requested");
        return ControlResult.STOPPING;
    }

    public RunState status() {
        return runState.get();
    }

    /**
     * Kill the in-process dispatcher's children and wait for it to record
     * their outcome. No-op when this process runs no dispatcher.
     */
    public void terminate(Duration grace) {
        Dispatcher dispatcher = current;
        if (dispatcher == null) {
            return;
        }
        dispatcher.terminate();
        try {
            if (!dispatcher.awaitStopped(grace)) {
                log.warn("Dispatcher did not stop within {}s", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
