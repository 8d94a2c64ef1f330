package airdev.devserver.discovery;

import airdev.devserver.model.TaskConfig;
import airdev.devserver.model.ViewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locally discovered tasks and views, keyed by slug.
 */
public class TaskCatalog {

    private static final Logger log = LoggerFactory.getLogger(TaskCatalog.class);

    private final ConcurrentHashMap<String, TaskConfig> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ViewConfig> views = new ConcurrentHashMap<>();

    public void putTask(TaskConfig task) {
        TaskConfig previous = tasks.put(task.slug(), task);
        if (previous != null && !previous.definitionFile().equals(task.definitionFile())) {
            log.warn("Task {} defined in {} replaces the definition in {}",
                    task.slug(), task.definitionFile(), previous.definitionFile());
        }
    }

    public void putView(ViewConfig view) {
        views.put(view.slug(), view);
    }

    public Optional<TaskConfig> task(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(tasks.get(slug));
    }

    public Optional<ViewConfig> view(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(views.get(slug));
    }

    /** Tasks sorted by slug. */
    public List<TaskConfig> tasks() {
        List<TaskConfig> out = new ArrayList<>(tasks.values());
        out.sort(Comparator.comparing(TaskConfig::slug));
        return out;
    }

    /** Views sorted by slug. */
    public List<ViewConfig> views() {
        List<ViewConfig> out = new ArrayList<>(views.values());
        out.sort(Comparator.comparing(ViewConfig::slug));
        return out;
    }

    /**
     * Replace the whole catalog with a fresh discovery result.
     */
    public void replaceAll(Discoverer.Result result) {
        tasks.clear();
        views.clear();
        result.tasks().forEach(this::putTask);
        result.views().forEach(this::putView);
        log.info("Catalog now holds {} tasks and {} views", tasks.size(), views.size());
    }
}
