package airdev.devserver.logs;

import airdev.devserver.model.LogItem;
import airdev.devserver.model.LogLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DevLogBrokerTest {

    private static LogItem line(long id, String text) {
        return new LogItem(Instant.now(), id, text, LogLevel.INFO, "my_task");
    }

    private static List<String> drain(LogWatcher watcher) throws InterruptedException {
        List<String> out = new ArrayList<>();
        Optional<LogItem> item;
        while ((item = watcher.poll(2, TimeUnit.SECONDS)).isPresent()) {
            out.add(item.get().text());
        }
        assertTrue(watcher.isDone(), "stream should have ended");
        return out;
    }

    @Test
    @DisplayName("A watcher registered mid-run sees history once, then live lines")
    void lateWatcherGetsHistoryThenLive() throws Exception {
        DevLogBroker broker = new DevLogBroker();
        broker.record(line(1, "a"));
        broker.record(line(2, "b"));

        LogWatcher watcher = broker.newWatcher();
        broker.record(line(3, "c"));
        broker.record(line(4, "d"));
        broker.close();

        assertEquals(List.of("a", "b", "c", "d"), drain(watcher));
    }

    @Test
    void watcherOnClosedBrokerGetsHistoryAndEnds() throws Exception {
        DevLogBroker broker = new DevLogBroker();
        broker.record(line(1, "only"));
        broker.close();

        assertEquals(List.of("only"), drain(broker.newWatcher()));
        assertTrue(broker.isClosed());
    }

    @Test
    void watcherWithNoLinesAfterRegistrationStillGetsHistory() throws Exception {
        DevLogBroker broker = new DevLogBroker();
        broker.record(line(1, "x"));
        LogWatcher watcher = broker.newWatcher();
        broker.close();

        assertEquals(List.of("x"), drain(watcher));
    }

    @Test
    void recordAfterCloseIsDropped() {
        DevLogBroker broker = new DevLogBroker();
        broker.close();
        broker.record(line(1, "late"));
        assertTrue(broker.history().isEmpty());
    }

    @Test
    void closingWatcherUnregistersAndWakesReader() throws Exception {
        DevLogBroker broker = new DevLogBroker();
        LogWatcher watcher = broker.newWatcher();
        assertEquals(1, broker.watcherCount());

        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<Optional<LogItem>> got = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                got.set(watcher.next());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        reader.start();

        watcher.close();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(got.get().isEmpty());
        assertEquals(0, broker.watcherCount());
    }

    @Test
    @DisplayName("Concurrent watchers each see every line exactly once")
    void concurrentWatchersSeeEveryLineOnce() throws Exception {
        DevLogBroker broker = new DevLogBroker();
        int lines = 500;
        List<LogWatcher> watchers = new ArrayList<>();

        Thread writer = new Thread(() -> {
            for (int i = 0; i < lines; i++) {
                broker.record(line(i, Integer.toString(i)));
            }
            broker.close();
        });
        watchers.add(broker.newWatcher());
        writer.start();
        for (int i = 0; i < 4; i++) {
            watchers.add(broker.newWatcher());
        }
        writer.join();

        for (LogWatcher watcher : watchers) {
            List<String> seen = drain(watcher);
            assertEquals(lines, seen.size());
            for (int i = 0; i < lines; i++) {
                assertEquals(Integer.toString(i), seen.get(i));
            }
        }
    }
}
