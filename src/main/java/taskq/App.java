package taskq;

import taskq.queue.cli.CliContext;
import taskq.queue.cli.QueueCli;
import taskq.queue.config.Dependencies;
import taskq.queue.config.QueueConfig;

/**
 * taskq command-line entry point.
 */
public class App {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        QueueConfig config;
        try {
            config = QueueConfig.load();
        } catch (RuntimeException e) {
            System.err.println("taskq: invalid configuration: " + e.getMessage());
            return QueueCli.ERROR;
        }

        try (Dependencies deps = Dependencies.create(config)) {
            return QueueCli.execute(args, CliContext.system(deps));
        }
    }
}
