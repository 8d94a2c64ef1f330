package airdev.devserver.runtime;

import airdev.devserver.builtins.BuiltinClient;
import airdev.devserver.model.StdApiRequest;
import airdev.devserver.model.TaskKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeRegistryTest {

    private final RuntimeRegistry registry = RuntimeRegistry.defaults();

    @Test
    void lookupByExtension() {
        assertInstanceOf(ShellRuntime.class, registry.lookup(Path.of("x/run.sh"), TaskKind.SHELL));
        assertInstanceOf(PythonRuntime.class, registry.lookup(Path.of("main.py"), TaskKind.PYTHON));
        assertInstanceOf(NodeRuntime.class, registry.lookup(Path.of("task.ts"), TaskKind.NODE));
        assertInstanceOf(SqlRuntime.class, registry.lookup(Path.of("q.sql"), TaskKind.SQL));
    }

    @Test
    void lookupByKindWhenNoExtensionMatches() {
        assertInstanceOf(RestRuntime.class, registry.lookup(null, TaskKind.REST));
        assertInstanceOf(ImageRuntime.class, registry.lookup(null, TaskKind.IMAGE));
    }

    @Test
    void unsupportedFileType() {
        UnsupportedRuntimeException e = assertThrows(UnsupportedRuntimeException.class,
                () -> registry.lookup(Path.of("main.rb"), TaskKind.SHELL));
        assertTrue(e.getMessage().contains(".rb"));
    }

    @Test
    void duplicateExtensionIsRejected() {
        assertThrows(IllegalStateException.class, () -> registry.register(".sh", new ShellRuntime()));
    }

    @Test
    void extensionOfDotFiles() {
        assertEquals("", RuntimeRegistry.extension(Path.of(".env")));
        assertEquals(".sh", RuntimeRegistry.extension(Path.of("a.b.sh")));
        assertEquals("", RuntimeRegistry.extension(null));
    }

    @Test
    void shellPassesParamsAsArguments() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "world");
        params.put("count", 3);
        params.put("tags", List.of("a", "b"));

        PreparedRun run = new ShellRuntime().prepare(
                new PrepareOptions(Path.of("/tmp/tasks/hello.sh"), params, Map.of(), "hello", "devrun1", null));

        assertEquals(List.of("bash", "/tmp/tasks/hello.sh", "name=world", "count=3", "tags=[\"a\",\"b\"]"),
                run.command());
        assertEquals(Path.of("/tmp/tasks"), run.workingDir());
    }

    @Test
    void imageTasksDoNotRunLocally() {
        ImageRuntime image = new ImageRuntime();
        assertFalse(image.supportsLocalExecution());
        assertThrows(UnsupportedRuntimeException.class, () -> image.prepare(
                new PrepareOptions(null, Map.of(), Map.of(), "img", "devrun1", null)));
    }

    @Test
    void sqlDelegatesToBuiltin(@TempDir Path dir) throws Exception {
        Path query = Files.writeString(dir.resolve("q.sql"), "SELECT 1");
        List<StdApiRequest> seen = new ArrayList<>();
        BuiltinClient builtins = request -> {
            seen.add(request);
            return List.of("builtins", "call");
        };

        PreparedRun run = new SqlRuntime().prepare(new PrepareOptions(
                query, Map.of(), Map.of("resource", "db"), "q", "devrun1", builtins));

        assertEquals(List.of("builtins", "call"), run.command());
        assertEquals("sql", seen.get(0).namespace());
        assertEquals("query", seen.get(0).name());
        assertEquals("SELECT 1", seen.get(0).request().get("query"));
        assertEquals("db", seen.get(0).request().get("resource"));
    }
}
