package taskq.queue.scheduler;

import taskq.queue.model.CancelResult;
import taskq.queue.model.ExecutionResult;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.store.Database;
import taskq.queue.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateMachineTest {

    private static Database db;
    private static JdbcTaskRepository repo;
    private static TaskStateMachine stateMachine;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:state-machine;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        repo = new JdbcTaskRepository(db);
        stateMachine = new TaskStateMachine(repo);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    private long pending() {
        return repo.insert(Task.builder().name("t").command("true").cwd("/tmp").createdAt(Instant.now()).build());
    }

    private Task reload(long id) {
        return repo.findById(id).orElseThrow();
    }

    @Test
    void startClaimsOnce() {
        long id = pending();

        assertTrue(stateMachine.start(id));
        assertFalse(stateMachine.start(id));
        assertEquals(TaskStatus.RUNNING, reload(id).status());
        assertNotNull(reload(id).startTime());
    }

    @Test
    void zeroExitCompletes() {
        long id = pending();
        stateMachine.start(id);

        assertEquals(TaskStatus.COMPLETED, stateMachine.finish(id, new ExecutionResult.Completed(0)));

        Task t = reload(id);
        assertEquals(TaskStatus.COMPLETED, t.status());
        assertEquals(0, t.exitCode());
        assertNull(t.errorMessage());
        assertFalse(t.endTime().isBefore(t.startTime()));
    }

    @Test
    void nonZeroExitFailsWithCode() {
        long id = pending();
        stateMachine.start(id);

        assertEquals(TaskStatus.FAILED, stateMachine.finish(id, new ExecutionResult.Completed(7)));

        Task t = reload(id);
        assertEquals(7, t.exitCode());
        assertEquals("exited with status 7", t.errorMessage());
    }

    @Test
    void timeoutFailsWithoutExitCode() {
        long id = pending();
        stateMachine.start(id);

        stateMachine.finish(id, new ExecutionResult.TimedOut(3));

        Task t = reload(id);
        assertEquals(TaskStatus.FAILED, t.status());
        assertNull(t.exitCode());
        assertEquals("timed out after 3s", t.errorMessage());
    }

    @Test
    void notStartedWritesNothing() {
        long id = pending();
        assertNull(stateMachine.finish(id, new ExecutionResult.NotStarted("gone")));
        assertEquals(TaskStatus.PENDING, reload(id).status());
    }

    @Test
    void finishAfterCancelKeepsCancelled() {
        long id = pending();
        stateMachine.start(id);
        assertEquals(CancelResult.CANCELLED_RUNNING, stateMachine.cancel(id));
        Instant cancelledAt = reload(id).endTime();

        assertEquals(TaskStatus.CANCELLED, stateMachine.finish(id, new ExecutionResult.Completed(0)));

        Task t = reload(id);
        assertEquals(TaskStatus.CANCELLED, t.status());
        assertEquals(cancelledAt, t.endTime(), "end_time is stamped once");
    }

    @Test
    void terminalTasksCannotBeCancelledOrRestarted() {
        long id = pending();
        stateMachine.start(id);
        stateMachine.finish(id, new ExecutionResult.Failed("boom"));

        assertEquals(CancelResult.REJECTED, stateMachine.cancel(id));
        assertFalse(stateMachine.start(id));
        assertEquals(TaskStatus.FAILED, reload(id).status());
        assertEquals("boom", reload(id).errorMessage());
    }

    @Test
    void cancelledPendingNeverStarts() {
        long id = pending();
        assertEquals(CancelResult.CANCELLED, stateMachine.cancel(id));
        assertFalse(stateMachine.start(id));
        assertNull(reload(id).startTime());
    }
}
