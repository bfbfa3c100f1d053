package taskq.queue.cli;

import taskq.queue.model.CancelResult;
import org.apache.commons.cli.CommandLine;

public class CancelCommand implements QueueCommand {

    @Override
    public String synopsis() {
        return "<id>";
    }

    @Override
    public int execute(CommandLine line, CliContext context) {
        String[] args = line.getArgs();
        if (args.length != 1) {
            throw new UsageException("exactly one task id is required");
        }
        long id;
        try {
            id = Long.parseLong(args[0].trim());
        } catch (NumberFormatException e) {
            throw new UsageException("task id must be a number: " + args[0]);
        }

        CancelResult result = context.deps().taskService().cancel(id);
        switch (result) {
            case CANCELLED -> context.out().println("Task " + id + " cancelled");
            case CANCELLED_RUNNING -> context.out().println("Task " + id + " cancelled; its process was signalled");
            case REJECTED -> {
                context.err().println("Task " + id + " is already finished and cannot be cancelled");
                return QueueCli.ERROR;
            }
            case NOT_FOUND -> {
                context.err().println("Task " + id + " not found");
                return QueueCli.ERROR;
            }
        }
        return QueueCli.OK;
    }
}
