package airdev.devserver.outputs;

/**
 * Output command carried by a protocol line.
 */
public enum OutputCommand {
    /** {@code airplane_output[:name] value}: append to a named top-level array */
    LEGACY(""),
    /** {@code airplane_output_set[:path] json} */
    SET("set"),
    /** {@code airplane_output_append[:path] json} */
    APPEND("append");

    private final String wireName;

    OutputCommand(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
