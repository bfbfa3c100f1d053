package taskq.queue.cli;

import org.apache.commons.cli.CommandLine;

/**
 * Command name to implementation. Constant names are the CLI words.
 */
public enum QueueCommands {
    init(new InitCommand()),
    submit(new SubmitCommand()),
    list(new ListCommand()),
    cancel(new CancelCommand()),
    start(new StartCommand()),
    stop(new StopCommand()),
    status(new StatusCommand());

    private final QueueCommand command;

    QueueCommands(QueueCommand command) {
        this.command = command;
    }

    public QueueCommand command() {
        return command;
    }

    public int execute(CommandLine line, CliContext context) throws Exception {
        return command.execute(line, context);
    }

    /**
     * @throws UsageException for an unknown command word
     */
    public static QueueCommands parse(String word) {
        for (QueueCommands c : values()) {
            if (c.name().equals(word)) {
                return c;
            }
        }
        throw new UsageException("Unknown command: " + word);
    }
}
