package airdev.devserver.runtime;

/**
 * No runtime can execute the task locally. The executor skips such runs with a warning.
 */
public class UnsupportedRuntimeException extends RuntimeException {

    public UnsupportedRuntimeException(String message) {
        super(message);
    }
}
