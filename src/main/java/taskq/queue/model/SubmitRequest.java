package taskq.queue.model;

import java.util.Map;

/**
 * Submission parameters as captured from the submitter.
 * Optional fields may be null; the task service fills defaults.
 */
public record SubmitRequest(
        String command,
        String name,
        int priority,
        Map<String, String> environment,
        String cwd,
        String stdoutFile,
        String stderrFile,
        Integer timeoutSeconds) {

    public static SubmitRequest of(String command, int priority) {
        return new SubmitRequest(command, null, priority, Map.of(), null, null, null, null);
    }

    public SubmitRequest withName(String name) {
        return new SubmitRequest(command, name, priority, environment, cwd, stdoutFile, stderrFile, timeoutSeconds);
    }

    public SubmitRequest withEnvironment(Map<String, String> environment) {
        return new SubmitRequest(command, name, priority, environment, cwd, stdoutFile, stderrFile, timeoutSeconds);
    }

    public SubmitRequest withCwd(String cwd) {
        return new SubmitRequest(command, name, priority, environment, cwd, stdoutFile, stderrFile, timeoutSeconds);
    }

    public SubmitRequest withOutput(String stdoutFile, String stderrFile) {
        return new SubmitRequest(command, name, priority, environment, cwd, stdoutFile, stderrFile, timeoutSeconds);
    }

    public SubmitRequest withTimeout(Integer timeoutSeconds) {
        return new SubmitRequest(command, name, priority, environment, cwd, stdoutFile, stderrFile, timeoutSeconds);
    }
}
