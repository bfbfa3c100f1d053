package taskq.queue.cli;

import org.apache.commons.cli.CommandLine;

public class StatusCommand implements QueueCommand {

    @Override
    public int execute(CommandLine line, CliContext context) {
        context.out().println("Scheduler is " + context.deps().schedulerControl().status().label());
        return QueueCli.OK;
    }
}
