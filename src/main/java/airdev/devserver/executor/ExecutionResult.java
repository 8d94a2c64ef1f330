package airdev.devserver.executor;

import airdev.devserver.model.Run;

/**
 * Outcome of one local execution.
 *
 * @param run     the finalized run as stored in the registry
 * @param skipped the task kind cannot run locally; nothing was started
 * @param warning message shown for a skipped run, null otherwise
 */
public record ExecutionResult(Run run, boolean skipped, String warning) {

    public static ExecutionResult completed(Run run) {
        return new ExecutionResult(run, false, null);
    }

    public static ExecutionResult skipped(Run run, String warning) {
        return new ExecutionResult(run, true, warning);
    }
}
