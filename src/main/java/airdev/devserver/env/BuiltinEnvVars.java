package airdev.devserver.env;

import airdev.devserver.remote.RemoteEnv;
import airdev.devserver.util.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code AIRPLANE_*} variables the server injects on top of the resolved env.
 */
public final class BuiltinEnvVars {

    public static final String RUNTIME_DEV = "dev";

    private BuiltinEnvVars() {
    }

    /** Variables shared by tasks and views: there is a single local env. */
    public static Map<String, String> common() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AIRPLANE_ENV_ID", RemoteEnv.STUDIO_ENV_ID);
        env.put("AIRPLANE_ENV_SLUG", RemoteEnv.STUDIO_ENV_ID);
        env.put("AIRPLANE_ENV_NAME", RemoteEnv.STUDIO_ENV_ID);
        env.put("AIRPLANE_ENV_IS_DEFAULT", "true");
        return env;
    }

    public static Map<String, String> forTask(TaskEnvRequest req) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AIRPLANE_API_HOST", req.apiHost());
        env.put("AIRPLANE_RESOURCES_VERSION", "2");
        env.put("AIRPLANE_RUN_ID", req.runId());
        env.put("AIRPLANE_PARENT_RUN_ID", req.parentRunId() == null ? "" : req.parentRunId());
        env.put("AIRPLANE_RUNNER_EMAIL", req.authInfo().userEmail());
        env.put("AIRPLANE_RUNNER_ID", req.authInfo().userId());
        env.put("AIRPLANE_RUNTIME", RUNTIME_DEV);
        // Locally the slug doubles as the task id.
        env.put("AIRPLANE_TASK_ID", req.taskSlug());
        env.put("AIRPLANE_TASK_SLUG", req.taskSlug());
        env.put("AIRPLANE_TASK_NAME", req.taskName());
        env.put("AIRPLANE_TEAM_ID", req.authInfo().teamId());
        env.put("AIRPLANE_RUNNER_NAME", req.authInfo().userName());
        env.put("AIRPLANE_TASK_URL", req.taskUrl());
        env.put("AIRPLANE_RUN_URL", req.runUrl());
        env.putAll(common());
        env.put("AIRPLANE_TOKEN", LocalRunToken.encode(req.runId()));
        env.put("AIRPLANE_RESOURCES", Json.write(req.aliasToResource()));
        if (req.tunnelToken() != null && !req.tunnelToken().isEmpty()) {
            env.put("AIRPLANE_TUNNEL_TOKEN", req.tunnelToken());
        }
        return env;
    }

    public static Map<String, String> forView(ViewEnvRequest req) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AIRPLANE_USER_EMAIL", req.authInfo().userEmail());
        env.put("AIRPLANE_USER_ID", req.authInfo().userId());
        env.put("AIRPLANE_USER_NAME", req.authInfo().userName());
        env.put("AIRPLANE_VIEW_ID", req.slug());
        env.put("AIRPLANE_VIEW_SLUG", req.slug());
        env.put("AIRPLANE_VIEW_NAME", req.name());
        env.put("AIRPLANE_VIEW_URL", req.viewUrl() == null ? "" : req.viewUrl());
        env.put("AIRPLANE_TEAM_ID", req.authInfo().teamId());
        if (!req.apiHeaders().isEmpty()) {
            env.put("AIRPLANE_API_HEADERS", Json.write(req.apiHeaders()));
        }
        env.putAll(common());
        return env;
    }
}
