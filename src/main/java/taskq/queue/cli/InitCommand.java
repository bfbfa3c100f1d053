package taskq.queue.cli;

import taskq.queue.config.QueueConfig;
import org.apache.commons.cli.CommandLine;

import java.nio.file.Files;

/**
 * Create the home directory, the log directory and the task table.
 */
public class InitCommand implements QueueCommand {

    @Override
    public int execute(CommandLine line, CliContext context) throws Exception {
        QueueConfig config = context.deps().config();
        Files.createDirectories(config.homeDir());
        Files.createDirectories(config.logDir());
        if (!context.deps().database().isHealthy()) {
            context.err().println("init: task store at " + config.databaseUrl() + " is not reachable");
            return QueueCli.ERROR;
        }
        context.out().println("Initialized task store at " + config.homeDir());
        return QueueCli.OK;
    }
}
