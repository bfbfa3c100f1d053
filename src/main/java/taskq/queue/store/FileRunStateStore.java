package taskq.queue.store;

import taskq.queue.model.RunState;
import taskq.queue.repository.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Run-state marker kept in a small text file.
 *
 * Format: {@code running <pid>} or {@code stopped}. A running marker whose
 * owner process is gone (scheduler crashed) reads as stopped.
 */
public class FileRunStateStore implements RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileRunStateStore.class);

    private final Path file;

    public FileRunStateStore(Path file) {
        this.file = file;
    }

    @Override
    public RunState get() {
        if (!Files.exists(file)) {
            return RunState.STOPPED;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read run-state marker: " + file, e);
        }

        String[] parts = content.split("\\s+");
        if (!RunState.RUNNING.label().equals(parts[0])) {
            return RunState.STOPPED;
        }
        if (parts.length > 1 && !ownerAlive(parts[1])) {
            log.warn("Run-state marker names dead process {} - treating scheduler as stopped", parts[1]);
            return RunState.STOPPED;
        }
        return RunState.RUNNING;
    }

    @Override
    public void set(RunState state) {
        String content = state == RunState.RUNNING
                ? state.label() + " " + ProcessHandle.current().pid()
                : state.label();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, content + System.lineSeparator(), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write run-state marker: " + file, e);
        }
        log.debug("Run-state marker set to {}", state);
    }

    public Path file() {
        return file;
    }

    private static boolean ownerAlive(String pidText) {
        try {
            long pid = Long.parseLong(pidText);
            return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        } catch (NumberFormatException e) {
            return true;
        }
    }
}
