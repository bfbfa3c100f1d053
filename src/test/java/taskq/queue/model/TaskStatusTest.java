package taskq.queue.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void pendingMayStartOrBeCancelled() {
        assertEquals(EnumSet.of(TaskStatus.RUNNING, TaskStatus.CANCELLED), TaskStatus.PENDING.allowedNext());
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
    }

    @Test
    void runningMayFinishOrBeCancelled() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.CANCELLED));
        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
    }

    @Test
    void terminalStatesAreFinal() {
        for (TaskStatus status : EnumSet.of(TaskStatus.COMPLETED, TaskStatus.CANCELLED, TaskStatus.FAILED)) {
            assertTrue(status.isTerminal());
            assertTrue(status.allowedNext().isEmpty(), status + " must have no successors");
        }
        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
    }

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(TaskStatus.RUNNING, TaskStatus.parse("running"));
        assertEquals(TaskStatus.FAILED, TaskStatus.parse(" Failed "));
        assertEquals("cancelled", TaskStatus.CANCELLED.label());
    }

    @Test
    void parseRejectsUnknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TaskStatus.parse("done"));
        assertEquals("Unknown status: done", e.getMessage());
    }

    @Test
    void executionResultTargets() {
        assertEquals(TaskStatus.COMPLETED, new ExecutionResult.Completed(0).targetStatus());
        assertEquals(TaskStatus.FAILED, new ExecutionResult.Completed(3).targetStatus());
        assertEquals(TaskStatus.FAILED, new ExecutionResult.TimedOut(1).targetStatus());
        assertEquals(TaskStatus.FAILED, new ExecutionResult.Failed("x").targetStatus());
        assertNull(new ExecutionResult.NotStarted("x").targetStatus());
    }
}
