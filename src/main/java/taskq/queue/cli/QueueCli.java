package taskq.queue.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Arrays;

/**
 * Parses {@code <command> [options] [args]} and dispatches to the command.
 *
 * Exit codes: 0 success, 1 operation error, 2 usage error. Every error is
 * reported as a single line on stderr.
 */
public final class QueueCli {

    private static final Logger log = LoggerFactory.getLogger(QueueCli.class);

    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int USAGE = 2;

    private QueueCli() {
    }

    public static int execute(String[] args, CliContext context) {
        log.debug("Going to execute: {}", String.join(" ", args));
        if (args.length == 0) {
            printUsage(context);
            return USAGE;
        }

        String word = args[0];
        QueueCommands command;
        try {
            command = QueueCommands.parse(word);
        } catch (UsageException e) {
            context.err().println(e.getMessage());
            printUsage(context);
            return USAGE;
        }

        final CommandLineParser parser = new DefaultParser();
        try {
            String[] rest = Arrays.copyOfRange(args, 1, args.length);
            CommandLine line = parser.parse(command.command().options(), rest, true);
            return command.execute(line, context);
        } catch (ParseException | UsageException e) {
            context.err().println(word + ": " + e.getMessage());
            printHelp(word, command.command(), context);
            return USAGE;
        } catch (IllegalArgumentException | IllegalStateException e) {
            context.err().println(word + ": " + firstLine(e));
            return ERROR;
        } catch (Exception e) {
            log.error("Error while executing: {}", String.join(" ", args), e);
            context.err().println(word + ": " + firstLine(e));
            return ERROR;
        }
    }

    private static void printUsage(CliContext context) {
        context.err().println("usage: taskq <command> [options]");
        for (QueueCommands c : QueueCommands.values()) {
            context.err().println("  " + c.name() + " " + c.command().synopsis());
        }
    }

    private static void printHelp(String word, QueueCommand command, CliContext context) {
        PrintWriter writer = new PrintWriter(context.err(), true);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "taskq " + word + " " + command.synopsis(),
                null, command.options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private static String firstLine(Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return message.lines().findFirst().orElse(message);
    }
}
