package airdev.devserver.env;

/**
 * The environment of a run could not be resolved; the run fails before its process starts.
 */
public class EnvResolutionException extends RuntimeException {

    public EnvResolutionException(String message) {
        super(message);
    }

    public EnvResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
