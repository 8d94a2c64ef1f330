package airdev.devserver.discovery;

import airdev.devserver.model.TaskConfig;
import airdev.devserver.model.ViewConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds task and view definitions under a directory.
 */
public interface Discoverer {

    /**
     * Definitions found, plus the files that could not be read.
     */
    record Result(List<TaskConfig> tasks, List<ViewConfig> views, List<DefinitionError> errors) {
        public Result {
            tasks = List.copyOf(tasks);
            views = List.copyOf(views);
            errors = List.copyOf(errors);
        }
    }

    record DefinitionError(Path file, String message) {
    }

    /**
     * Walk {@code root} and parse every definition file.
     * A malformed file is reported in {@link Result#errors()} and does not stop discovery.
     *
     * @throws IOException if the directory cannot be walked
     */
    Result discover(Path root) throws IOException;
}
