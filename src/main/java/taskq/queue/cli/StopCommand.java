package taskq.queue.cli;

import taskq.queue.model.ControlResult;
import org.apache.commons.cli.CommandLine;

public class StopCommand implements QueueCommand {

    @Override
    public int execute(CommandLine line, CliContext context) {
        ControlResult result = context.deps().schedulerControl().stop();
        if (result == ControlResult.NOT_RUNNING) {
            context.out().println("Scheduler is not running");
        } else {
            context.out().println("Stop requested; running tasks will finish");
        }
        return QueueCli.OK;
    }
}
