package airdev.devserver.outputs;

/**
 * Effective output line (after chunk assembly) is above the configured byte limit.
 */
public class OutputLineTooLongException extends OutputProtocolException {

    private final int size;
    private final int limit;

    public OutputLineTooLongException(int size, int limit) {
        super("output line too long: " + size + " bytes exceeds limit of " + limit);
        this.size = size;
        this.limit = limit;
    }

    public int size() {
        return size;
    }

    public int limit() {
        return limit;
    }
}
