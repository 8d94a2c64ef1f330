package airdev.devserver.logs;

import airdev.devserver.model.LogItem;

import java.util.List;

/**
 * Fans out the log lines of one run to any number of watchers.
 * Every watcher sees the full history exactly once, then live lines, then end of stream.
 */
public interface LogBroker {

    /**
     * Record a line: push it to every registered watcher and keep it for later ones.
     * A no-op once the broker is closed.
     */
    void record(LogItem item);

    /**
     * Register a watcher. On a closed broker the watcher gets the history and ends immediately.
     */
    LogWatcher newWatcher();

    /**
     * Mark the run's logs complete and end every registered watcher's stream.
     */
    void close();

    boolean isClosed();

    /** Lines recorded so far, in recording order. */
    List<LogItem> history();
}
