package airdev.devserver.logs;

import airdev.devserver.model.LogItem;
import airdev.devserver.model.LogLevel;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Receiving end of a {@link LogBroker}. One reader per watcher.
 */
public final class LogWatcher implements AutoCloseable {

    private static final LogItem END_OF_STREAM = new LogItem(Instant.EPOCH, -1, "", LogLevel.DEBUG, "");

    private final BlockingQueue<LogItem> queue = new LinkedBlockingQueue<>();
    private final DevLogBroker broker;

    /** Guarded by the broker's lock. */
    boolean replayed;

    private volatile boolean ended;
    private boolean endQueued; // guarded by this

    LogWatcher(DevLogBroker broker) {
        this.broker = broker;
    }

    /**
     * Block until the next line arrives.
     *
     * @return the line, or empty once the stream has ended
     */
    public Optional<LogItem> next() throws InterruptedException {
        if (ended) {
            return Optional.empty();
        }
        return unwrap(queue.take());
    }

    /**
     * Wait up to the timeout for the next line.
     *
     * @return the line, or empty on timeout or end of stream (see {@link #isDone()})
     */
    public Optional<LogItem> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (ended) {
            return Optional.empty();
        }
        LogItem item = queue.poll(timeout, unit);
        return item == null ? Optional.empty() : unwrap(item);
    }

    /** True once the end of stream has been consumed. */
    public boolean isDone() {
        return ended;
    }

    /**
     * Stop watching: unregister from the broker and end the stream so a blocked reader wakes up.
     */
    @Override
    public void close() {
        broker.unregister(this);
        end();
    }

    void deliver(LogItem item) {
        queue.add(item);
    }

    synchronized void end() {
        if (!endQueued) {
            endQueued = true;
            queue.add(END_OF_STREAM);
        }
    }

    private Optional<LogItem> unwrap(LogItem item) {
        if (item == END_OF_STREAM) {
            ended = true;
            return Optional.empty();
        }
        return Optional.of(item);
    }
}
