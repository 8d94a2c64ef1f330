package airdev.devserver.logs;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort detection of well-known failure signatures in task output.
 * Results are hints for the developer; they never change a run's outcome.
 */
public final class ErrorScanner {

    private static final String NODE_ESM_MARKER = "Error [ERR_REQUIRE_ESM]";
    private static final Pattern NODE_MODULE = Pattern.compile("node_modules/((?:@[^/\\s]+/)?[^/\\s]+)/");

    private ErrorScanner() {
    }

    /**
     * Detect Node's "require() of ES module" failure.
     *
     * @return the offending module name (empty when the format is not recognized),
     *         or empty Optional when the line is not an ESM error
     */
    public static Optional<String> scanForNodeEsm(String line) {
        if (!line.contains(NODE_ESM_MARKER)) {
            return Optional.empty();
        }
        Matcher m = NODE_MODULE.matcher(line);
        return Optional.of(m.find() ? m.group(1) : "");
    }

    /**
     * Human hint for a detected ESM failure, or null.
     */
    public static String hint(String line) {
        return scanForNodeEsm(line)
                .map(module -> module.isEmpty()
                        ? "This task imports an ES module with require(). Use a CommonJS build of the dependency or switch the task to ESM."
                        : "Module \"" + module + "\" is ES-module only. Pin a CommonJS version of it or switch the task to ESM.")
                .orElse(null);
    }
}
