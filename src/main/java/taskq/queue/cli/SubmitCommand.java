package taskq.queue.cli;

import taskq.queue.model.SubmitRequest;
import taskq.queue.model.Task;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

/**
 * Enqueue a shell command with the caller's environment and working directory.
 */
public class SubmitCommand implements QueueCommand {

    private static final Options OPTIONS = new Options();

    static {
        OPTIONS.addOption("n", "name", true, "Display name (defaults to the command)");
        OPTIONS.addOption("p", "priority", true, "Priority 0-9, lower runs first (default 0)");
        OPTIONS.addOption(Option.builder().longOpt("stdout").hasArg().desc("File to append standard output to").build());
        OPTIONS.addOption(Option.builder().longOpt("stderr").hasArg().desc("File to append standard error to").build());
        OPTIONS.addOption("t", "timeout", true, "Seconds before the task is killed and failed (0 = none)");
    }

    static final int DEFAULT_PRIORITY = 0;

    @Override
    public Options options() {
        return OPTIONS;
    }

    @Override
    public String synopsis() {
        return "[options] <command...>";
    }

    @Override
    public int execute(CommandLine line, CliContext context) {
        String[] words = line.getArgs();
        if (words.length == 0) {
            throw new UsageException("a command to run is required");
        }
        String command = String.join(" ", words);

        int priority = line.hasOption("priority")
                ? parseInt("priority", line.getOptionValue("priority"))
                : DEFAULT_PRIORITY;
        Integer timeout = line.hasOption("timeout")
                ? parseInt("timeout", line.getOptionValue("timeout"))
                : null;

        SubmitRequest request = SubmitRequest.of(command, priority)
                .withName(line.getOptionValue("name"))
                .withEnvironment(context.environment())
                .withCwd(context.cwd().toString())
                .withOutput(line.getOptionValue("stdout"), line.getOptionValue("stderr"))
                .withTimeout(timeout);

        Task task = context.deps().taskService().submit(request);
        context.out().println("Submitted task " + task.id() + " '" + task.name() + "' (priority "
                + task.priority() + ")");
        return QueueCli.OK;
    }

    static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + option + " expects an integer: " + value);
        }
    }
}
