package airdev.devserver.builtins;

/**
 * Builtins cannot run on this machine: unsupported platform or missing binary.
 */
public class BuiltinUnavailableException extends RuntimeException {

    public BuiltinUnavailableException(String message) {
        super(message);
    }
}
