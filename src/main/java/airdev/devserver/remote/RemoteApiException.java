package airdev.devserver.remote;

/**
 * Remote API call failed. Status is 0 when no HTTP response was received.
 */
public class RemoteApiException extends RuntimeException {

    private final int status;

    public RemoteApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
