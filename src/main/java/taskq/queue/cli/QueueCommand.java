package taskq.queue.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

/**
 * One CLI sub-command.
 */
public interface QueueCommand {

    /**
     * Options accepted after the command name.
     */
    default Options options() {
        return new Options();
    }

    /**
     * One-line argument synopsis shown in help, e.g. {@code <id>}.
     */
    default String synopsis() {
        return "";
    }

    /**
     * @return process exit code
     */
    int execute(CommandLine line, CliContext context) throws Exception;
}
