package taskq.queue.cli;

import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Print tasks in dispatch order, optionally filtered by status.
 */
public class ListCommand implements QueueCommand {

    private static final Options OPTIONS = new Options();

    static {
        OPTIONS.addOption("s", "status", true, "Comma-separated statuses to include, e.g. pending,running");
    }

    @Override
    public Options options() {
        return OPTIONS;
    }

    @Override
    public String synopsis() {
        return "[--status s1,s2]";
    }

    @Override
    public int execute(CommandLine line, CliContext context) {
        Set<TaskStatus> filter = parseStatuses(line.getOptionValues("status"));
        List<Task> tasks = context.deps().taskService().list(filter);
        if (tasks.isEmpty()) {
            context.out().println("No tasks");
            return QueueCli.OK;
        }
        context.out().print(TaskTable.render(tasks));
        return QueueCli.OK;
    }

    static Set<TaskStatus> parseStatuses(String[] values) {
        Set<TaskStatus> statuses = EnumSet.noneOf(TaskStatus.class);
        if (values == null) {
            return statuses;
        }
        for (String value : values) {
            for (String part : value.split(",")) {
                if (part.isBlank()) {
                    continue;
                }
                try {
                    statuses.add(TaskStatus.parse(part.trim()));
                } catch (IllegalArgumentException e) {
                    throw new UsageException(e.getMessage());
                }
            }
        }
        return statuses;
    }
}
