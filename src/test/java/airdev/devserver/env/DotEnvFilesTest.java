package airdev.devserver.env;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DotEnvFilesTest {

    @TempDir
    Path root;

    @Test
    void locateOrdersDotEnvBeforeAirplaneEnvRootFirst() throws Exception {
        Path nested = Files.createDirectories(root.resolve("a/b"));
        Path entrypoint = Files.writeString(nested.resolve("main.py"), "");
        Files.writeString(root.resolve(".env"), "");
        Files.writeString(nested.resolve(".env"), "");
        Files.writeString(root.resolve("airplane.env"), "");
        Files.writeString(root.resolve("a/airplane.env"), "");

        List<Path> files = DotEnvFiles.locate(root, entrypoint);

        assertEquals(List.of(
                root.resolve(".env"),
                nested.resolve(".env"),
                root.resolve("airplane.env"),
                root.resolve("a/airplane.env")), files);
    }

    @Test
    void entrypointOutsideRootOnlyReadsItsOwnDirectory() throws Exception {
        Path other = Files.createDirectories(root.resolve("other"));
        Path taskRoot = Files.createDirectories(root.resolve("taskroot"));
        Files.writeString(root.resolve(".env"), "");
        Path entrypoint = Files.writeString(other.resolve("x.sh"), "");

        assertEquals(List.of(other.toAbsolutePath().normalize()),
                DotEnvFiles.directories(taskRoot, entrypoint));
    }

    @Test
    void readFileStripsQuotesAndExport() throws Exception {
        Path file = Files.writeString(root.resolve(".env"), String.join("\n",
                "# comment",
                "PLAIN=value",
                "QUOTED=\"with spaces\"",
                "SINGLE='single'",
                "export EXPORTED=yes",
                "EMPTY=",
                ""));

        Map<String, String> vars = DotEnvFiles.readFile(file);

        assertEquals("value", vars.get("PLAIN"));
        assertEquals("with spaces", vars.get("QUOTED"));
        assertEquals("single", vars.get("SINGLE"));
        assertEquals("yes", vars.get("EXPORTED"));
        assertEquals("", vars.get("EMPTY"));
    }

    @Test
    void laterFilesWin() throws Exception {
        Path entrypoint = Files.writeString(root.resolve("main.sh"), "");
        Files.writeString(root.resolve(".env"), "K=dotenv\n");
        Files.writeString(root.resolve("airplane.env"), "K=airplane\n");

        assertEquals("airplane", DotEnvFiles.read(root, entrypoint).get("K"));
    }
}
