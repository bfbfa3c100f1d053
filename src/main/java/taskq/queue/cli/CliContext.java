package taskq.queue.cli;

import taskq.queue.config.Dependencies;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * What a command sees of its caller: wired services, output streams and the
 * caller's environment and working directory.
 */
public record CliContext(
        Dependencies deps,
        PrintStream out,
        PrintStream err,
        Map<String, String> environment,
        Path cwd) {

    public static CliContext system(Dependencies deps) {
        return new CliContext(deps, System.out, System.err, System.getenv(),
                Path.of(System.getProperty("user.dir")));
    }
}
