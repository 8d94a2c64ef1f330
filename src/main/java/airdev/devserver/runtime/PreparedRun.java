package airdev.devserver.runtime;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line and working directory of a local process.
 */
public record PreparedRun(List<String> command, Path workingDir) {

    public PreparedRun {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
    }
}
