package airdev.devserver.service;

/**
 * A task, resource, prompt or other named object does not exist. Served as 404.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
