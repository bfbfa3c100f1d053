package taskq.queue.config;

import taskq.queue.repository.RunStateStore;
import taskq.queue.repository.TaskRepository;
import taskq.queue.scheduler.Dispatcher;
import taskq.queue.scheduler.SchedulerControl;
import taskq.queue.scheduler.TaskExecutor;
import taskq.queue.scheduler.TaskStateMachine;
import taskq.queue.monitor.AdmissionControl;
import taskq.queue.monitor.ResourceMonitor;
import taskq.queue.monitor.SystemResourceMonitor;
import taskq.queue.service.TaskService;
import taskq.queue.store.Database;
import taskq.queue.store.FileRunStateStore;
import taskq.queue.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Manual dependency injection container.
 * The database is opened on first use, so {@code status} and {@code stop}
 * never touch the store.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(QueueConfig.load())) {
 *     deps.taskService().submit(request);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final RunStateStore runStateStore;
    private final Supplier<ResourceMonitor> monitorFactory;
    private final SchedulerControl schedulerControl;

    // Store and everything on top of it (lazy-initialized)
    private Database database;
    private TaskRepository taskRepository;
    private TaskStateMachine stateMachine;
    private TaskService taskService;

    private Dependencies(QueueConfig config, RunStateStore runStateStore, Supplier<ResourceMonitor> monitorFactory) {
        this.config = config;
        this.runStateStore = runStateStore;
        this.monitorFactory = monitorFactory;
        this.schedulerControl = new SchedulerControl(runStateStore, this::newDispatcher);
        log.debug("Dependencies created with config: {}", config);
    }

    /**
     * Create dependencies with the file run-state marker and the system monitor.
     */
    public static Dependencies create(QueueConfig config) {
        return new Dependencies(config, new FileRunStateStore(config.runStateFile()), SystemResourceMonitor::new);
    }

    /**
     * Create dependencies with explicit run-state and monitor implementations.
     */
    public static Dependencies create(QueueConfig config, RunStateStore runStateStore, ResourceMonitor monitor) {
        return new Dependencies(config, runStateStore, () -> monitor);
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public RunStateStore runStateStore() {
        return runStateStore;
    }

    public SchedulerControl schedulerControl() {
        return schedulerControl;
    }

    /**
     * Open the store, creating the schema if absent.
     */
    public synchronized Database database() {
        if (database == null) {
            log.info("Opening task store at {}", config.databaseUrl());
            database = new Database(config);
        }
        return database;
    }

    public synchronized TaskRepository taskRepository() {
        if (taskRepository == null) {
            taskRepository = new JdbcTaskRepository(database());
        }
        return taskRepository;
    }

    public synchronized TaskStateMachine stateMachine() {
        if (stateMachine == null) {
            stateMachine = new TaskStateMachine(taskRepository());
        }
        return stateMachine;
    }

    public synchronized TaskService taskService() {
        if (taskService == null) {
            taskService = new TaskService(taskRepository(), stateMachine(), config);
        }
        return taskService;
    }

    private Dispatcher newDispatcher() {
        TaskExecutor executor = new TaskExecutor(taskRepository(), stateMachine());
        AdmissionControl admission = new AdmissionControl(monitorFactory.get(), config);
        return new Dispatcher(taskRepository(), runStateStore, executor, stateMachine(), admission, config);
    }

    @Override
    public synchronized void close() {
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
            database = null;
        }
    }
}
