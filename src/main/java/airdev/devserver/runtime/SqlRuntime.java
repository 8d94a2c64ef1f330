package airdev.devserver.runtime;

import airdev.devserver.builtins.BuiltinSlug;
import airdev.devserver.model.TaskKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL tasks run as the {@code sql_query} builtin. The query file is re-read on every run.
 */
public class SqlRuntime implements TaskRuntime {

    @Override
    public TaskKind kind() {
        return TaskKind.SQL;
    }

    @Override
    public Path root(Path entrypoint) {
        return entrypoint.toAbsolutePath().normalize().getParent();
    }

    @Override
    public boolean supportsLocalExecution() {
        return true;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) throws IOException {
        String query;
        try {
            query = Files.readString(options.entrypoint(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("unable to read sql file " + options.entrypoint() + ": " + e.getMessage(), e);
        }
        Map<String, Object> request = new LinkedHashMap<>(options.kindOptions());
        request.put("query", query);
        return new PreparedRun(
                options.builtins().command(BuiltinSlug.request(BuiltinSlug.SQL_QUERY, request)),
                root(options.entrypoint()));
    }
}
