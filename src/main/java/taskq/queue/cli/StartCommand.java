package taskq.queue.cli;

import taskq.queue.model.ControlResult;
import taskq.queue.scheduler.SchedulerControl;
import org.apache.commons.cli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Run the scheduler in the foreground until {@code stop} is issued.
 * SIGINT/SIGTERM kill running children and record them as failed.
 */
public class StartCommand implements QueueCommand {

    private static final Logger log = LoggerFactory.getLogger(StartCommand.class);

    private static final Duration TERMINATION_GRACE = Duration.ofSeconds(10);

    @Override
    public int execute(CommandLine line, CliContext context) {
        SchedulerControl control = context.deps().schedulerControl();

        Thread hook = new Thread(() -> control.terminate(TERMINATION_GRACE), "taskq-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            ControlResult result = control.start();
            if (result == ControlResult.ALREADY_RUNNING) {
                context.out().println("Scheduler is already running");
            } else {
                context.out().println("Scheduler stopped");
            }
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM is shutting down; shutdown hook left in place");
            }
        }
        return QueueCli.OK;
    }
}
