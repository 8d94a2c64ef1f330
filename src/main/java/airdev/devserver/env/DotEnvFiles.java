package airdev.devserver.env;

import org.ini4j.Config;
import org.ini4j.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code .env} and {@code airplane.env} files between a task's root and its entrypoint.
 *
 * Directories are visited root first. All {@code .env} files are read before any
 * {@code airplane.env} file, and a key from a later file replaces the earlier value.
 */
public final class DotEnvFiles {

    private static final Logger log = LoggerFactory.getLogger(DotEnvFiles.class);

    static final List<String> FILE_NAMES = List.of(".env", "airplane.env");
    private static final String EXPORT_PREFIX = "export ";

    private DotEnvFiles() {
    }

    /**
     * Files to load, in load order.
     *
     * @param root       the task's runtime root; the entrypoint directory when it is not an ancestor
     * @param entrypoint the task entrypoint file
     */
    public static List<Path> locate(Path root, Path entrypoint) {
        List<Path> dirs = directories(root, entrypoint);
        List<Path> files = new ArrayList<>();
        for (String name : FILE_NAMES) {
            for (Path dir : dirs) {
                Path candidate = dir.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    log.debug("Loading env vars from {}", candidate);
                    files.add(candidate);
                }
            }
        }
        return files;
    }

    /**
     * Merged variables of every located file.
     *
     * @throws EnvResolutionException if a file cannot be read
     */
    public static Map<String, String> read(Path root, Path entrypoint) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (Path file : locate(root, entrypoint)) {
            merged.putAll(readFile(file));
        }
        return merged;
    }

    /**
     * Parse one dotenv file. Quotes around values and a leading {@code export} are removed.
     */
    public static Map<String, String> readFile(Path file) {
        Config config = new Config();
        config.setEscape(false);
        config.setEmptyOption(true);
        Options options = new Options();
        options.setConfig(config);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            options.load(reader);
        } catch (IOException e) {
            throw new EnvResolutionException("reading " + file + ": " + e.getMessage(), e);
        }

        Map<String, String> vars = new LinkedHashMap<>();
        for (String rawKey : options.keySet()) {
            String key = rawKey.strip();
            if (key.startsWith(EXPORT_PREFIX)) {
                key = key.substring(EXPORT_PREFIX.length()).strip();
            }
            String value = options.get(rawKey);
            vars.put(key, unquote(value == null ? "" : value.strip()));
        }
        return vars;
    }

    static List<Path> directories(Path root, Path entrypoint) {
        Path dir = entrypoint.toAbsolutePath().normalize().getParent();
        Path top = root.toAbsolutePath().normalize();
        List<Path> dirs = new ArrayList<>();
        if (dir == null) {
            return dirs;
        }
        if (!dir.startsWith(top)) {
            dirs.add(dir);
            return dirs;
        }
        for (Path d = dir; d != null && d.startsWith(top); d = d.getParent()) {
            dirs.add(0, d);
        }
        return dirs;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
