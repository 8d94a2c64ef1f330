package airdev.devserver.logs;

import airdev.devserver.model.LogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory {@link LogBroker} for one local run.
 *
 * A single lock guards the watcher set, the history and each watcher's replay flag,
 * so a line is either in the replayed history or pushed live, never both.
 * Watcher queues are unbounded: recording never waits on a slow reader.
 */
public final class DevLogBroker implements LogBroker {

    private static final Logger log = LoggerFactory.getLogger(DevLogBroker.class);

    private final Object lock = new Object();
    private final Set<LogWatcher> watchers = new LinkedHashSet<>();
    private final List<LogItem> history = new ArrayList<>();
    private boolean closed;

    @Override
    public void record(LogItem item) {
        synchronized (lock) {
            if (closed) {
                log.warn("Dropping log line recorded after close: {}", item.text());
                return;
            }
            for (LogWatcher watcher : watchers) {
                replayOnce(watcher);
                watcher.deliver(item);
            }
            history.add(item);
        }
    }

    @Override
    public LogWatcher newWatcher() {
        synchronized (lock) {
            LogWatcher watcher = new LogWatcher(this);
            if (closed) {
                replayOnce(watcher);
                watcher.end();
            } else {
                watchers.add(watcher);
            }
            return watcher;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            for (LogWatcher watcher : watchers) {
                // Covers watchers that attached after the last record.
                replayOnce(watcher);
                watcher.end();
            }
            watchers.clear();
            closed = true;
        }
    }

    @Override
    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @Override
    public List<LogItem> history() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    int watcherCount() {
        synchronized (lock) {
            return watchers.size();
        }
    }

    void unregister(LogWatcher watcher) {
        synchronized (lock) {
            watchers.remove(watcher);
        }
    }

    private void replayOnce(LogWatcher watcher) {
        if (watcher.replayed) {
            return;
        }
        watcher.replayed = true;
        for (LogItem past : history) {
            watcher.deliver(past);
        }
    }
}
