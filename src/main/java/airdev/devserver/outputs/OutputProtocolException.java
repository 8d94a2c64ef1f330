package airdev.devserver.outputs;

/**
 * A line that looked like an output command could not be parsed or applied.
 * The line is skipped; the run continues.
 */
public class OutputProtocolException extends RuntimeException {

    public OutputProtocolException(String message) {
        super(message);
    }

    public OutputProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
