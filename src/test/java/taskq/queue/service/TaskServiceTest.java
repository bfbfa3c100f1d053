package taskq.queue.service;

import taskq.queue.config.QueueConfig;
import taskq.queue.model.CancelResult;
import taskq.queue.model.SubmitRequest;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.scheduler.TaskStateMachine;
import taskq.queue.store.Database;
import taskq.queue.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    @TempDir
    Path dir;

    private TaskService service;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:service-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        QueueConfig config = QueueConfig.defaults().withHomeDir(dir).withLogDir(dir.resolve("logs"));
        service = new TaskService(repo, new TaskStateMachine(repo), config);
    }

    private SubmitRequest request(String command, int priority) {
        return SubmitRequest.of(command, priority)
                .withCwd(dir.toString())
                .withEnvironment(Map.of("FOO", "bar"));
    }

    // ==================== submit ====================

    @Test
    void submitStoresPendingTaskWithDefaults() {
        Task task = service.submit(request("echo hello", 3));

        assertNotNull(task.id());
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals("echo hello", task.name());
        assertEquals(3, task.priority());
        assertEquals(Map.of("FOO", "bar"), task.environment());
        assertEquals(dir.toAbsolutePath().normalize().toString(), task.cwd());
        assertNotNull(task.createdAt());
        assertNull(task.pid());
        assertNull(task.startTime());

        Path out = Path.of(task.stdoutFile());
        Path err = Path.of(task.stderrFile());
        assertTrue(out.isAbsolute());
        assertEquals(dir.resolve("logs"), out.getParent());
        assertTrue(out.getFileName().toString().matches("task-[0-9a-f]{8}\\.out"));
        assertEquals(out.getFileName().toString().replace(".out", ".err"), err.getFileName().toString());
    }

    @Test
    void relativeOutputResolvesAgainstCwd() {
        Task task = service.submit(request("true", 0).withOutput("out/a.log", "/tmp/b.log").withName("named"));

        assertEquals(dir.resolve("out/a.log").toAbsolutePath().normalize().toString(), task.stdoutFile());
        assertEquals("/tmp/b.log", task.stderrFile());
        assertEquals("named", task.name());
    }

    @Test
    void rejectsPriorityOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(request("true", -1)));
        assertThrows(IllegalArgumentException.class, () -> service.submit(request("true", 10)));
        assertEquals(0, repo.list(null).size(), "nothing written on validation failure");
    }

    @Test
    void rejectsNegativeTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withTimeout(-1)));
        assertEquals(0, service.submit(request("true", 0).withTimeout(0)).timeoutSeconds());
    }

    @Test
    void rejectsBlankCommand() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(request("  ", 0)));
    }

    @Test
    void rejectsMissingCwd() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withCwd(dir.resolve("nope").toString())));
        assertTrue(e.getMessage().startsWith("working directory does not exist"));
    }

    @Test
    void rejectsMalformedEnvironment() {
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withEnvironment(Map.of("A=B", "x"))));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withEnvironment(Map.of("", "x"))));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withEnvironment(Map.of("A", "x\0y"))));

        Map<String, String> nullValue = new HashMap<>();
        nullValue.put("A", null);
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(request("true", 0).withEnvironment(nullValue)));
    }

    @Test
    void emptyEnvironmentIsAllowed() {
        Task task = service.submit(request("true", 0).withEnvironment(Map.of()));
        assertEquals(Map.of(), task.environment());
    }

    @Test
    void longNamesAreTruncated() {
        Task task = service.submit(request("echo " + "x".repeat(400), 0));
        assertEquals(256, task.name().length());
    }

    @Test
    void listFiltersAndOrders() {
        service.submit(request("a", 3));
        Task b = service.submit(request("b", 1));
        service.submit(request("c", 2));
        service.cancel(b.id());

        assertEquals(List.of("c", "a"),
                service.list(Set.of(TaskStatus.PENDING)).stream().map(Task::name).toList());
        assertEquals("b", service.list(null).get(0).name());
    }

    // ==================== cancel ====================

    @Test
    void cancelPendingLeavesNoEndTime() {
        Task task = service.submit(request("true", 0));

        assertEquals(CancelResult.CANCELLED, service.cancel(task.id()));

        Task after = service.find(task.id()).orElseThrow();
        assertEquals(TaskStatus.CANCELLED, after.status());
        assertNull(after.endTime());
        assertNull(after.startTime());
    }

    @Test
    void cancelRunningSignalsProcess() throws Exception {
        Task task = service.submit(request("sleep 30", 0));
        Process process = new ProcessBuilder("/bin/sh", "-c", "sleep 30").start();
        try {
            assertTrue(repo.markRunning(task.id(), Instant.now()));
            repo.updatePid(task.id(), process.pid());

            assertEquals(CancelResult.CANCELLED_RUNNING, service.cancel(task.id()));

            assertTrue(process.waitFor(5, TimeUnit.SECONDS), "process should have been terminated");
            Task after = service.find(task.id()).orElseThrow();
            assertEquals(TaskStatus.CANCELLED, after.status());
            assertNotNull(after.endTime());
            assertFalse(after.endTime().isBefore(after.startTime()));
        } finally {
            process.destroyForcibly();
        }
    }

    @Test
    void cancelRunningWithExitedProcessStillCancels() throws Exception {
        Task task = service.submit(request("true", 0));
        Process process = new ProcessBuilder("/bin/sh", "-c", "exit 0").start();
        process.waitFor();
        repo.markRunning(task.id(), Instant.now());
        repo.updatePid(task.id(), process.pid());

        assertEquals(CancelResult.CANCELLED_RUNNING, service.cancel(task.id()));
        assertEquals(TaskStatus.CANCELLED, service.find(task.id()).orElseThrow().status());
    }

    @Test
    void cancelCompletedIsRejectedAndUnchanged() {
        Task task = service.submit(request("true", 0));
        repo.markRunning(task.id(), Instant.now());
        repo.finish(task.id(), TaskStatus.COMPLETED, Instant.now(), 0, null);

        assertEquals(CancelResult.REJECTED, service.cancel(task.id()));
        assertEquals(TaskStatus.COMPLETED, service.find(task.id()).orElseThrow().status());
    }

    @Test
    void cancelTwiceIsRejected() {
        Task task = service.submit(request("true", 0));
        assertEquals(CancelResult.CANCELLED, service.cancel(task.id()));
        assertEquals(CancelResult.REJECTED, service.cancel(task.id()));
    }

    @Test
    void cancelUnknownTask() {
        assertEquals(CancelResult.NOT_FOUND, service.cancel(987654));
    }

    @Test
    void outputFilesAreNotCreatedAtSubmit() {
        Task task = service.submit(request("true", 0));
        assertFalse(Files.exists(Path.of(task.stdoutFile())));
    }
}
