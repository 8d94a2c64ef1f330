package airdev.devserver.repository;

/**
 * No run is registered under the given id.
 */
public class RunNotFoundException extends RuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("run with id \"" + runId + "\" not found");
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
