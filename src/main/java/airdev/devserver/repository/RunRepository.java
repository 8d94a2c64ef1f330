package airdev.devserver.repository;

import airdev.devserver.logs.LogBroker;
import airdev.devserver.model.Run;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Registry of the runs of this server process.
 * Every registered run owns a {@link LogBroker} for its output lines.
 */
public interface RunRepository {

    /**
     * Register a run, or replace a pre-allocated one with the same id.
     * The run is prepended to the task's history (at most once) and attached to its parent.
     *
     * @param taskKey history key, usually the task slug; null to keep the run out of any history
     * @param runId   run id
     * @param run     run state
     */
    void add(String taskKey, String runId, Run run);

    /**
     * Find a run by id.
     *
     * @param runId the run id
     * @return the run if registered
     */
    Optional<Run> get(String runId);

    /**
     * Atomically replace a run with the mutator's result.
     * A terminal status never changes once set.
     *
     * @param runId   the run id
     * @param mutator maps the current state to the new one
     * @return the new state
     * @throws RunNotFoundException  if the id is not registered
     * @throws IllegalStateException if the mutator changes a terminal status
     */
    Run update(String runId, UnaryOperator<Run> mutator);

    /**
     * Runs recorded for a task, most recent first.
     *
     * @param taskKey history key
     * @return list of runs
     */
    List<Run> history(String taskKey);

    /**
     * Direct children of a run.
     *
     * @param runId parent run id
     * @return list of runs, in registration order
     */
    List<Run> descendants(String runId);

    /**
     * Log broker of a run.
     *
     * @throws RunNotFoundException if the id is not registered
     */
    LogBroker logs(String runId);

    /**
     * Install the action that stops a run's process. Replaces any earlier hook.
     */
    void onCancel(String runId, Runnable hook);

    /**
     * Invoke the cancel hook of a run, if one is installed.
     *
     * @return true if a hook ran
     */
    boolean triggerCancel(String runId);
}
