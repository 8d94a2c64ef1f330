package airdev.devserver.discovery;

import airdev.devserver.model.EnvVarValue;
import airdev.devserver.model.TaskConfig;
import airdev.devserver.model.TaskKind;
import airdev.devserver.model.ViewConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlDefinitionDiscovererTest {

    @TempDir
    Path root;

    private final YamlDefinitionDiscoverer discoverer = new YamlDefinitionDiscoverer();

    private Path write(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    void readsShellTask() throws Exception {
        write("tasks/hello.task.yaml", String.join("\n",
                "slug: hello",
                "name: Say hello",
                "parameters:",
                "  - slug: name",
                "    type: shorttext",
                "    default: world",
                "shell:",
                "  entrypoint: hello.sh",
                "  envVars:",
                "    PLAIN: value",
                "    FROM_CONFIG:",
                "      config: my_config",
                "resources:",
                "  db: demo_db",
                ""));

        Discoverer.Result result = discoverer.discover(root);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        assertEquals(1, result.tasks().size());
        TaskConfig task = result.tasks().get(0);
        assertEquals("hello", task.slug());
        assertEquals("Say hello", task.name());
        assertEquals(TaskKind.SHELL, task.kind());
        assertEquals(root.resolve("tasks/hello.sh").toAbsolutePath().normalize(), task.entrypoint());
        assertEquals(EnvVarValue.of("value"), task.env().get("PLAIN"));
        assertEquals(EnvVarValue.fromConfig("my_config"), task.env().get("FROM_CONFIG"));
        assertEquals(Map.of("db", "demo_db"), task.resources());
        assertEquals("world", task.parameters().get(0).defaultValue());
        assertTrue(task.kindOptions().isEmpty());
    }

    @Test
    void sqlTaskKeepsKindOptionsAndResourceAlias() throws Exception {
        write("q.task.yml", String.join("\n",
                "slug: query",
                "sql:",
                "  entrypoint: q.sql",
                "  resource: demo_db",
                "  queryArgs:",
                "    id: 1",
                "configs: [shared]",
                ""));

        TaskConfig task = discoverer.discover(root).tasks().get(0);

        assertEquals(TaskKind.SQL, task.kind());
        assertEquals("query", task.name());
        assertEquals(Map.of("db", "demo_db"), task.resources());
        assertEquals(Map.of("id", 1), task.kindOptions().get("queryArgs"));
        assertFalse(task.kindOptions().containsKey("resource"));
        assertEquals(List.of("shared"), task.configs());
    }

    @Test
    void dockerIsImageKind() throws Exception {
        write("img.task.yaml", "slug: img\ndocker:\n  image: alpine\n  command: echo hi\n");
        assertEquals(TaskKind.IMAGE, discoverer.discover(root).tasks().get(0).kind());
    }

    @Test
    void workflowRuntimeIsRecognized() throws Exception {
        write("flow.task.yaml", "slug: flow\nruntime: workflow\nnode:\n  entrypoint: flow.ts\n");
        write("plain.task.yaml", "slug: plain\nshell:\n  entrypoint: plain.sh\n");

        Map<String, Boolean> workflows = new HashMap<>();
        discoverer.discover(root).tasks().forEach(t -> workflows.put(t.slug(), t.workflow()));
        assertEquals(Map.of("flow", true, "plain", false), workflows);
    }

    @Test
    void invalidDefinitionsAreReportedNotThrown() throws Exception {
        write("a.task.yaml", "name: no slug\nshell:\n  entrypoint: a.sh\n");
        write("b.task.yaml", "slug: two_kinds\nshell: {}\npython: {}\n");
        write("c.task.yaml", "slug: no_kind\n");
        write("ok.task.yaml", "slug: ok\nshell:\n  entrypoint: ok.sh\n");

        Discoverer.Result result = discoverer.discover(root);

        assertEquals(1, result.tasks().size());
        assertEquals(3, result.errors().size());
    }

    @Test
    void skipsDependencyDirectories() throws Exception {
        write("node_modules/pkg/x.task.yaml", "slug: hidden\nnode:\n  entrypoint: x.ts\n");
        write(".git/y.task.yaml", "slug: hidden2\nshell:\n  entrypoint: y.sh\n");
        write("visible.task.yaml", "slug: visible\nnode:\n  entrypoint: v.ts\n");

        List<TaskConfig> tasks = discoverer.discover(root).tasks();
        assertEquals(1, tasks.size());
        assertEquals("visible", tasks.get(0).slug());
    }

    @Test
    void readsViews() throws Exception {
        write("ui/dash.view.yaml", "slug: dash\nname: Dashboard\nentrypoint: Dash.tsx\nenvVars:\n  A: b\n");

        Discoverer.Result result = discoverer.discover(root);

        assertEquals(1, result.views().size());
        ViewConfig view = result.views().get(0);
        assertEquals("Dashboard", view.name());
        assertEquals(root.resolve("ui/Dash.tsx").toAbsolutePath().normalize(), view.entrypoint());
        assertEquals(EnvVarValue.of("b"), view.env().get("A"));
    }

    @Test
    void catalogReplacesContents() throws Exception {
        write("one.task.yaml", "slug: one\nshell:\n  entrypoint: one.sh\n");
        TaskCatalog catalog = new TaskCatalog();
        catalog.replaceAll(discoverer.discover(root));
        assertTrue(catalog.task("one").isPresent());

        Files.delete(root.resolve("one.task.yaml"));
        write("two.task.yaml", "slug: two\nshell:\n  entrypoint: two.sh\n");
        catalog.replaceAll(discoverer.discover(root));

        assertTrue(catalog.task("one").isEmpty());
        assertEquals(List.of("two"), catalog.tasks().stream().map(TaskConfig::slug).toList());
        assertTrue(catalog.task(null).isEmpty());
    }
}
