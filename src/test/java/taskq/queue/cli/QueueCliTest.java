package taskq.queue.cli;

import taskq.queue.config.Dependencies;
import taskq.queue.config.QueueConfig;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.monitor.StubResourceMonitor;
import taskq.queue.store.InMemoryRunStateStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueueCliTest {

    private static final AtomicInteger DB_SEQ = new AtomicInteger();

    @TempDir
    Path dir;

    private Dependencies deps;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CliContext context;

    @BeforeEach
    void setup() {
        QueueConfig config = QueueConfig.defaults()
                .withHomeDir(dir.resolve("home"))
                .withDatabaseUrl("jdbc:h2:mem:cli-" + DB_SEQ.incrementAndGet()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config, new InMemoryRunStateStore(), StubResourceMonitor.idle());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        context = new CliContext(deps,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                Map.of("FOO", "bar"),
                dir);
    }

    @AfterEach
    void teardown() {
        deps.close();
    }

    private int run(String... args) {
        return QueueCli.execute(args, context);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsIsUsageError() {
        assertEquals(QueueCli.USAGE, run());
        assertTrue(err().contains("usage: taskq"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(QueueCli.USAGE, run("explode"));
        assertTrue(err().startsWith("Unknown command: explode"));
    }

    @Test
    void initCreatesHomeAndSchema() {
        assertEquals(QueueCli.OK, run("init"));
        assertTrue(Files.isDirectory(dir.resolve("home/logs")));
        assertTrue(out().contains("Initialized task store"));
    }

    @Test
    void submitCapturesCallerContext() {
        assertEquals(QueueCli.OK, run("submit", "-n", "greet", "-p", "2", "-t", "30", "--stdout", "hello.out",
                "echo", "$FOO"));

        List<Task> tasks = deps.taskService().list(null);
        assertEquals(1, tasks.size());
        Task task = tasks.get(0);
        assertEquals("greet", task.name());
        assertEquals("echo $FOO", task.command());
        assertEquals(2, task.priority());
        assertEquals(30, task.timeoutSeconds());
        assertEquals(Map.of("FOO", "bar"), task.environment());
        assertEquals(dir.toAbsolutePath().normalize().toString(), task.cwd());
        assertEquals(dir.resolve("hello.out").toString(), task.stdoutFile());
        assertTrue(out().startsWith("Submitted task " + task.id()));
    }

    @Test
    void submitDefaultsToPriorityZero() {
        assertEquals(QueueCli.OK, run("submit", "true"));
        assertEquals(0, deps.taskService().list(null).get(0).priority());
    }

    @Test
    void commandWordsAfterTheCommandAreNotOptions() {
        assertEquals(QueueCli.OK, run("submit", "ls", "-p", "9"));
        Task task = deps.taskService().list(null).get(0);
        assertEquals("ls -p 9", task.command());
        assertEquals(0, task.priority());
    }

    @Test
    void submitWithoutCommandIsUsageError() {
        assertEquals(QueueCli.USAGE, run("submit", "-p", "1"));
        assertTrue(err().contains("a command to run is required"));
    }

    @Test
    void nonNumericPriorityIsUsageError() {
        assertEquals(QueueCli.USAGE, run("submit", "-p", "high", "true"));
    }

    @Test
    void outOfRangePriorityIsOperationError() {
        assertEquals(QueueCli.ERROR, run("submit", "-p", "12", "true"));
        assertEquals("submit: priority must be between 0 and 9: 12", err().lines().findFirst().orElse(""));
        assertTrue(deps.taskService().list(null).isEmpty());
    }

    @Test
    void listRendersTable() {
        run("submit", "-n", "second", "-p", "5", "true");
        run("submit", "-n", "first", "-p", "1", "true");
        out.reset();

        assertEquals(QueueCli.OK, run("list"));

        List<String> lines = out().lines().toList();
        assertEquals(4, lines.size());
        assertTrue(lines.get(0).matches("ID\\s+\\| Name\\s+\\| Priority \\| Status\\s+\\| Created\\s+\\| Started \\| Ended \\| PID"),
                lines.get(0));
        assertTrue(lines.get(2).contains("first"));
        assertTrue(lines.get(2).contains("pending"));
        assertTrue(lines.get(3).contains("second"));
    }

    @Test
    void listFiltersByStatus() {
        run("submit", "-n", "keep", "true");
        run("submit", "-n", "drop", "true");
        long dropId = deps.taskService().list(null).stream()
                .filter(t -> t.name().equals("drop")).findFirst().orElseThrow().id();
        run("cancel", String.valueOf(dropId));
        out.reset();

        assertEquals(QueueCli.OK, run("list", "--status", "cancelled,failed"));
        assertTrue(out().contains("drop"));
        assertFalse(out().contains("keep"));
    }

    @Test
    void listEmpty() {
        assertEquals(QueueCli.OK, run("list"));
        assertEquals("No tasks", out().trim());
    }

    @Test
    void listWithUnknownStatusIsUsageError() {
        assertEquals(QueueCli.USAGE, run("list", "-s", "sleeping"));
    }

    @Test
    void cancelPendingTask() {
        run("submit", "true");
        long id = deps.taskService().list(null).get(0).id();

        assertEquals(QueueCli.OK, run("cancel", String.valueOf(id)));
        assertEquals(TaskStatus.CANCELLED, deps.taskService().find(id).orElseThrow().status());

        assertEquals(QueueCli.ERROR, run("cancel", String.valueOf(id)));
        assertTrue(err().contains("already finished"));
    }

    @Test
    void cancelUnknownTask() {
        assertEquals(QueueCli.ERROR, run("cancel", "777"));
        assertTrue(err().contains("Task 777 not found"));
    }

    @Test
    void cancelNeedsNumericId() {
        assertEquals(QueueCli.USAGE, run("cancel", "abc"));
        assertEquals(QueueCli.USAGE, run("cancel"));
    }

    @Test
    void statusAndStopWhenIdle() {
        assertEquals(QueueCli.OK, run("status"));
        assertEquals(QueueCli.OK, run("stop"));
        assertEquals(List.of("Scheduler is stopped", "Scheduler is not running"), out().lines().toList());
    }
}
