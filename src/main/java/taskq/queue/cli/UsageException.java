package taskq.queue.cli;

/**
 * Bad command-line arguments; reported with exit code 2.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
