package taskq.queue.scheduler;

import taskq.queue.config.QueueConfig;
import taskq.queue.model.ExecutionResult;
import taskq.queue.model.RunState;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.repository.RunStateStore;
import taskq.queue.repository.TaskRepository;
import taskq.queue.monitor.AdmissionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * The polling loop. Sole writer of PENDING -> RUNNING (through the executor).
 *
 * <p>
 * Each iteration:
 * <ol>
 * <li>query pending tasks in (priority, created_at, id) order; none found means an idle
 * sleep with exponential backoff</li>
 * <li>if the host is overloaded, skip dispatch and cool down</li>
 * <li>otherwise hand at most {@code batchSize} tasks to the worker pool, staggering the
 * releases, then pause for the poll interval</li>
 * </ol>
 *
 * The worker pool is fixed-size with a hand-off queue: when every worker is
 * busy the pool rejects the submission and the task simply stays pending.
 *
 * <p>
 * The loop runs while the run-state marker reads running. On exit it waits
 * for all in-flight executions, then writes the marker as stopped. A stop
 * request never kills children; {@link #terminate()} does.
 */
public class Dispatcher {

    private final TaskRepository taskRepository;
    private final RunStateStore runState;
    private final TaskExecutor executor;
    private final TaskStateMachine stateMachine;
    private final AdmissionControl admission;
    private final QueueConfig config;
    private final Logger log;

    // released to the pool but not yet reconciled; keeps a slow claim from being re-released
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong releasedCount = new AtomicLong();
    private volatile int poolSize;

    public Dispatcher(TaskRepository taskRepository, RunStateStore runState, TaskExecutor executor,
            TaskStateMachine stateMachine, AdmissionControl admission, QueueConfig config) {
        this(taskRepository, runState, executor, stateMachine, admission, config,
                LoggerFactory.getLogger(Dispatcher.class));
    }

    public Dispatcher(TaskRepository taskRepository, RunStateStore runState, TaskExecutor executor,
            TaskStateMachine stateMachine, AdmissionControl admission, QueueConfig config, Logger log) {
        this.taskRepository = taskRepository;
        this.runState = runState;
        this.executor = executor;
        this.stateMachine = stateMachine;
        this.admission = admission;
        this.config = config;
        this.log = log;
    }

    /**
     * Run the loop on the calling thread until the marker leaves running.
     * A dispatcher instance runs once.
     */
    public void run() {
        if (stopped.getCount() == 0) {
            throw new IllegalStateException("Dispatcher has already run");
        }
        poolSize = admission.choosePoolSize();
        ThreadPoolExecutor pool = newPool(poolSize);
        IdleBackoff backoff = new IdleBackoff(config.pollInterval(), config.maxIdleBackoff());
        log.info("Dispatcher started: {} workers, batch size {}", poolSize, config.batchSize());

        try {
            while (isRunning()) {
                try {
                    iterate(pool, backoff);
                } catch (RuntimeException e) {
                    // store or monitor trouble: log and try again next iteration
                    log.error("Dispatcher iteration failed", e);
                    pause(config.pollInterval());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatcher interrupted");
        } finally {
            drain(pool);
        }
    }

    /**
     * Flip the marker and kill every live child. Used on JVM termination;
     * the affected tasks end FAILED.
     */
    public void terminate() {
        log.warn("Scheduler terminating - killing {} running task(s)", executor.liveCount());
        try {
            runState.set(RunState.STOPPED);
        } catch (RuntimeException e) {
            log.error("Failed to write run-state marker on termination", e);
        }
        executor.destroyAll();
    }

    /**
     * Wait for the loop to drain and write the stopped marker.
     *
     * @return true if the dispatcher stopped within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int poolSize() {
        return poolSize;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public long releasedCount() {
        return releasedCount.get();
    }

    private void iterate(ThreadPoolExecutor pool, IdleBackoff backoff) throws InterruptedException {
        List<Task> pending = candidates();
        if (pending.isEmpty()) {
            Duration delay = backoff.next();
            log.debug("No pending tasks, sleeping {}ms", delay.toMillis());
            pause(delay);
            return;
        }
        backoff.reset();

        if (admission.isOverloaded()) {
            log.warn("Host overloaded - {} pending task(s) held back for {}s", pending.size(),
                    config.overloadCooldown().toSeconds());
            pause(config.overloadCooldown());
            return;
        }

        int released = release(pool, pending);
        if (released > 0) {
            log.debug("Released {} task(s), {} in flight", released, inFlight.size());
        }
        pause(config.pollInterval());
    }

    /**
     * Pending tasks that are not already in the hands of a worker.
     */
    private List<Task> candidates() {
        int batch = config.batchSize();
        return taskRepository.findPending(batch + inFlight.size()).stream()
                .filter(t -> !inFlight.contains(t.id()))
                .limit(batch)
                .collect(Collectors.toList());
    }

    private int release(ThreadPoolExecutor pool, List<Task> batch) throws InterruptedException {
        int released = 0;
        for (Task task : batch) {
            if (!isRunning()) {
                break;
            }
            if (released > 0) {
                pause(config.releaseStagger());
            }
            if (!inFlight.add(task.id())) {
                continue;
            }
            try {
                pool.execute(() -> runTask(task));
            } catch (RejectedExecutionException e) {
                inFlight.remove(task.id());
                log.debug("All {} workers busy - task {} stays pending", poolSize, task.id());
                break;
            }
            released++;
            releasedCount.incrementAndGet();
            log.info("Released task {} '{}' (priority {})", task.id(), task.name(), task.priority());
        }
        return released;
    }

    private void runTask(Task task) {
        long taskId = task.id();
        try {
            ExecutionResult result = executor.execute(task);
            TaskStatus end = stateMachine.finish(taskId, result);
            if (end != null) {
                log.info("Task {} ended {}", taskId, end);
            }
        } catch (RuntimeException e) {
            log.error("Task {} execution failed", taskId, e);
            try {
                stateMachine.finish(taskId, new ExecutionResult.Failed("scheduler error: " + e.getMessage()));
            } catch (RuntimeException again) {
                // the row may stay RUNNING; it is visible in the listing
                log.error("Task {} left inconsistent: failure could not be recorded", taskId, again);
            }
        } finally {
            inFlight.remove(taskId);
        }
    }

    /**
     * Sleep in slices of {@code stopCheckInterval}, returning early once the
     * marker leaves running.
     */
    private void pause(Duration duration) throws InterruptedException {
        long deadline = System.nanoTime() + duration.toNanos();
        long slice = Math.max(1, config.stopCheckInterval().toMillis());
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0 || !isRunning()) {
                return;
            }
            Thread.sleep(Math.min(slice, remainingMs));
        }
    }

    private boolean isRunning() {
        return runState.get() == RunState.RUNNING;
    }

    private void drain(ThreadPoolExecutor pool) {
        pool.shutdown();
        if (pool.getActiveCount() > 0) {
            log.info("Waiting for {} in-flight task(s) to finish", pool.getActiveCount());
        }
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                executor.destroyAll();
            }
        }

        try {
            runState.set(RunState.STOPPED);
        } catch (RuntimeException e) {
            log.error("Failed to write stopped marker", e);
        }
        stopped.countDown();
        log.info("Dispatcher stopped after releasing {} task(s)", releasedCount.get());

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadPoolExecutor newPool(int workers) {
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "taskq-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        pool.prestartAllCoreThreads();
        return pool;
    }
}
