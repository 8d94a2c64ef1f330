package airdev.devserver.store;

import airdev.devserver.logs.DevLogBroker;
import airdev.devserver.logs.LogBroker;
import airdev.devserver.model.Run;
import airdev.devserver.repository.RunNotFoundException;
import airdev.devserver.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-memory {@link RunRepository}.
 *
 * Each map is updated through {@code compute*}, so work on one run id never waits on another.
 * Nothing survives a restart.
 */
public class InMemoryRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRunRepository.class);

    private static final class Entry {
        final Run run;
        final LogBroker broker;
        final Runnable cancelHook;

        Entry(Run run, LogBroker broker, Runnable cancelHook) {
            this.run = run;
            this.broker = broker;
            this.cancelHook = cancelHook;
        }

        Entry withRun(Run next) {
            return new Entry(next, broker, cancelHook);
        }

        Entry withCancelHook(Runnable hook) {
            return new Entry(run, broker, hook);
        }
    }

    private final ConcurrentHashMap<String, Entry> runs = new ConcurrentHashMap<>();
    // Copy-on-write id lists; replaced wholesale inside compute.
    private final ConcurrentHashMap<String, List<String>> historyByTask = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<String>> childrenByParent = new ConcurrentHashMap<>();

    @Override
    public void add(String taskKey, String runId, Run run) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(run, "run");
        if (!runId.equals(run.id())) {
            run = run.toBuilder().id(runId).build();
        }
        final Run registered = run;

        Entry previous = runs.get(runId);
        runs.compute(runId, (id, existing) -> existing == null
                ? new Entry(registered, new DevLogBroker(), null)
                : existing.withRun(registered));

        if (taskKey != null) {
            historyByTask.compute(taskKey, (k, ids) -> {
                if (ids != null && ids.contains(runId)) {
                    return ids;
                }
                List<String> next = new ArrayList<>();
                next.add(runId);
                if (ids != null) {
                    next.addAll(ids);
                }
                return List.copyOf(next);
            });
        }

        String parentId = registered.parentId();
        boolean newlyAttached = previous == null || !Objects.equals(previous.run.parentId(), parentId);
        if (parentId != null && !parentId.isEmpty() && newlyAttached) {
            childrenByParent.compute(parentId, (k, ids) -> {
                List<String> next = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
                if (!next.contains(runId)) {
                    next.add(runId);
                }
                return List.copyOf(next);
            });
        }
        log.debug("Registered run {} (task={}, parent={})", runId, taskKey, parentId);
    }

    @Override
    public Optional<Run> get(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        Entry entry = runs.get(runId);
        return entry == null ? Optional.empty() : Optional.of(entry.run);
    }

    @Override
    public Run update(String runId, UnaryOperator<Run> mutator) {
        Entry updated = runs.computeIfPresent(runId, (id, entry) -> {
            Run current = entry.run;
            Run next = Objects.requireNonNull(mutator.apply(current), "mutator returned null");
            if (current.isTerminal() && next.status() != current.status()) {
                throw new IllegalStateException(
                        "run " + runId + " already finished as " + current.status().wireName());
            }
            return entry.withRun(next);
        });
        if (updated == null) {
            throw new RunNotFoundException(runId);
        }
        return updated.run;
    }

    @Override
    public List<Run> history(String taskKey) {
        if (taskKey == null) {
            return List.of();
        }
        return resolve(historyByTask.getOrDefault(taskKey, List.of()));
    }

    @Override
    public List<Run> descendants(String runId) {
        if (runId == null) {
            return List.of();
        }
        return resolve(childrenByParent.getOrDefault(runId, List.of()));
    }

    @Override
    public LogBroker logs(String runId) {
        Entry entry = runs.get(runId);
        if (entry == null) {
            throw new RunNotFoundException(runId);
        }
        return entry.broker;
    }

    @Override
    public void onCancel(String runId, Runnable hook) {
        if (runs.computeIfPresent(runId, (id, entry) -> entry.withCancelHook(hook)) == null) {
            throw new RunNotFoundException(runId);
        }
    }

    @Override
    public boolean triggerCancel(String runId) {
        Entry entry = runs.get(runId);
        if (entry == null) {
            throw new RunNotFoundException(runId);
        }
        if (entry.cancelHook == null) {
            return false;
        }
        // Outside any map lock: the hook kills processes and may block briefly.
        entry.cancelHook.run();
        return true;
    }

    /** Number of registered runs. */
    public int size() {
        return runs.size();
    }

    private List<Run> resolve(List<String> ids) {
        List<Run> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Entry entry = runs.get(id);
            if (entry != null) {
                out.add(entry.run);
            }
        }
        return out;
    }
}
