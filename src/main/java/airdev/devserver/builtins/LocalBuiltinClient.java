package airdev.devserver.builtins;

import airdev.devserver.model.StdApiRequest;
import airdev.devserver.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link BuiltinClient} backed by a builtins binary already present on disk.
 * The request is passed as a single JSON argument.
 */
public class LocalBuiltinClient implements BuiltinClient {

    private static final Logger log = LoggerFactory.getLogger(LocalBuiltinClient.class);

    private static final Map<String, Set<String>> SUPPORTED = Map.of(
            "darwin", Set.of("amd64", "arm64"),
            "linux", Set.of("amd64", "arm64"));

    private final Path binary;
    private final String os;
    private final String arch;

    public LocalBuiltinClient(Path binary) {
        this(binary, normalizeOs(System.getProperty("os.name", "")), normalizeArch(System.getProperty("os.arch", "")));
    }

    public LocalBuiltinClient(Path binary, String os, String arch) {
        this.binary = binary;
        this.os = os;
        this.arch = arch;
    }

    @Override
    public List<String> command(StdApiRequest request) {
        if (!isSupported(os, arch)) {
            throw new BuiltinUnavailableException("Local builtins execution for " + os + " " + arch
                    + " systems is under development. Please reach out to support@airplane.dev for assistance.");
        }
        if (binary == null || !Files.isExecutable(binary)) {
            throw new BuiltinUnavailableException("builtins binary not found"
                    + (binary == null ? "; set AIRDEV_BUILTINS_BIN" : " at " + binary));
        }
        log.debug("Using builtins binary {}", binary);
        return List.of(binary.toString(), Json.write(request));
    }

    static boolean isSupported(String os, String arch) {
        Set<String> archs = SUPPORTED.get(os);
        return archs != null && archs.contains(arch);
    }

    static String normalizeOs(String osName) {
        String n = osName.toLowerCase(Locale.ROOT);
        if (n.contains("mac") || n.contains("darwin")) {
            return "darwin";
        }
        if (n.contains("linux")) {
            return "linux";
        }
        if (n.contains("windows")) {
            return "windows";
        }
        return n;
    }

    static String normalizeArch(String osArch) {
        String a = osArch.toLowerCase(Locale.ROOT);
        return switch (a) {
            case "x86_64", "amd64" -> "amd64";
            case "aarch64", "arm64" -> "arm64";
            default -> a;
        };
    }
}
