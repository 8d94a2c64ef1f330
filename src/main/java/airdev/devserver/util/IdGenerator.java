package airdev.devserver.util;

import java.security.SecureRandom;

/**
 * Prefixed ids for objects created by the dev server.
 */
public final class IdGenerator {

    public static final String RUN_PREFIX = "devrun";
    public static final String PROMPT_PREFIX = "pmt";
    public static final String DISPLAY_PREFIX = "dsp";

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 20;
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    public static String runId() {
        return generate(RUN_PREFIX);
    }

    public static String promptId() {
        return generate(PROMPT_PREFIX);
    }

    public static String displayId() {
        return generate(DISPLAY_PREFIX);
    }

    public static String generate(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length() + SUFFIX_LENGTH).append(prefix);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /** Whether the id was generated locally with the given prefix. */
    public static boolean hasPrefix(String id, String prefix) {
        return id != null && id.startsWith(prefix) && id.length() == prefix.length() + SUFFIX_LENGTH;
    }
}
