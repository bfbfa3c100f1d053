package taskq.queue.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Signals a child process together with everything it spawned.
 * Descendants are collected before the parent is signalled; once the shell
 * dies its children are re-parented and no longer reachable from it.
 */
public final class ProcessTrees {

    private ProcessTrees() {
    }

    /**
     * Send a polite termination request (SIGTERM on Unix) to a recorded pid and
     * its descendants.
     *
     * @param startedNotBefore if non-null, a process that started earlier than
     *                         this is assumed to be a recycled pid and is left alone
     * @return true if a live process was found and signalled
     */
    public static boolean terminate(long pid, Instant startedNotBefore) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return false;
        }
        ProcessHandle root = handle.get();
        if (startedNotBefore != null) {
            Optional<Instant> started = root.info().startInstant();
            // start instants are coarse on some platforms
            if (started.isPresent() && started.get().isBefore(startedNotBefore.minusSeconds(1))) {
                return false;
            }
        }
        List<ProcessHandle> descendants = root.descendants().toList();
        boolean signalled = root.destroy();
        descendants.forEach(ProcessHandle::destroy);
        return signalled;
    }

    /**
     * Kill a child and its descendants, then reap it.
     *
     * @return true if the child is gone within the grace period
     */
    public static boolean destroyForcibly(Process process, Duration grace) throws InterruptedException {
        List<ProcessHandle> descendants = process.descendants().toList();
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
        return process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
    }
}
