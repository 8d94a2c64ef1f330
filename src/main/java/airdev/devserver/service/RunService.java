package airdev.devserver.service;

import airdev.devserver.builtins.BuiltinSlug;
import airdev.devserver.config.DevServerConfig;
import airdev.devserver.discovery.TaskCatalog;
import airdev.devserver.executor.ExecutionResult;
import airdev.devserver.executor.LocalExecutor;
import airdev.devserver.executor.LocalRunConfig;
import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Display;
import airdev.devserver.model.Parameter;
import airdev.devserver.model.Prompt;
import airdev.devserver.model.Resource;
import airdev.devserver.model.Run;
import airdev.devserver.model.RunStatus;
import airdev.devserver.model.StdApiRequest;
import airdev.devserver.model.TaskConfig;
import airdev.devserver.model.TaskKind;
import airdev.devserver.remote.AuthInfo;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import airdev.devserver.repository.RunNotFoundException;
import airdev.devserver.repository.RunRepository;
import airdev.devserver.util.IdGenerator;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for runs: execution, cancellation, prompts and displays.
 */
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final int MAX_MARKDOWN_LENGTH = 100_000;
    static final int MAX_TABLE_ROWS = 10_000;
    static final int MAX_TABLE_COLUMNS = 100;

    private final RunRepository runs;
    private final TaskCatalog catalog;
    private final ConfigService configs;
    private final LocalExecutor executor;
    private final RemoteApiClient remote;
    private final AuthInfo authInfo;
    private final DevServerConfig config;

    public RunService(RunRepository runs,
                      TaskCatalog catalog,
                      ConfigService configs,
                      LocalExecutor executor,
                      RemoteApiClient remote,
                      AuthInfo authInfo,
                      DevServerConfig config) {
        this.runs = runs;
        this.catalog = catalog;
        this.configs = configs;
        this.executor = executor;
        this.remote = remote;
        this.authInfo = authInfo;
        this.config = config;
    }

    /**
     * Execute a task and wait for it to finish.
     * Tasks that are neither local nor builtin are started in the fallback env instead.
     *
     * @return the finalized run, or the registered remote run
     * @throws NotFoundException        if the task or a resource cannot be found
     * @throws IllegalArgumentException on an invalid request
     */
    public Run execute(ExecuteCommand cmd) {
        String slug = cmd.slug();
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug is required");
        }

        String preallocated = cmd.runId() != null && runs.get(cmd.runId()).isPresent() ? cmd.runId() : null;
        try {
            return start(cmd, preallocated);
        } catch (RuntimeException e) {
            if (preallocated != null) {
                failPreallocated(preallocated, e);
            }
            throw e;
        }
    }

    private Run start(ExecuteCommand cmd, String preallocated) {
        String slug = cmd.slug();
        String parentId = cmd.parentRunId();
        String envSlug;
        if (parentId != null) {
            Run parent = runs.get(parentId).orElseThrow(() -> new RunNotFoundException(parentId));
            envSlug = parent.envSlug();
            if (parent.workflow() && runs.descendants(parentId).size() + 1 >= config.maxChildRuns()) {
                throw new IllegalArgumentException("Parent run has exceeded the maximum limit of "
                        + config.maxChildRuns() + " child runs");
            }
        } else {
            envSlug = cmd.envSlug() != null ? cmd.envSlug() : config.envSlug();
        }

        Optional<TaskConfig> local = catalog.task(slug);
        boolean builtin = BuiltinSlug.isBuiltin(slug);
        if (!builtin && local.isEmpty()) {
            return executeRemote(slug, cmd.paramValues(), parentId, envSlug);
        }

        String runId = preallocated != null ? preallocated : IdGenerator.runId();
        Map<String, Resource> mergedResources = configs.mergedResources(envSlug);

        LocalRunConfig.Builder runConfig = LocalRunConfig.builder()
                .runId(runId)
                .parentRunId(parentId)
                .slug(slug)
                .fallbackEnvSlug(envSlug)
                .devConfigEnv(configs.devConfig().envVars())
                .authInfo(authInfo)
                .apiHost(config.localApiHost())
                .taskUrl(config.studioUrl("/task/" + slug))
                .runUrl(config.studioUrl("/runs/" + runId))
                .tunnelToken(config.tunnelToken());

        Run.Builder run = Run.builder()
                .id(runId)
                .status(RunStatus.QUEUED)
                .createdAt(Instant.now())
                .creatorId(authInfo.userId().isEmpty() ? null : authInfo.userId())
                .parentId(parentId)
                .envSlug(envSlug);

        Map<String, String> attachments = new LinkedHashMap<>();
        if (builtin) {
            attachments.putAll(builtinAttachment(cmd.resources(), mergedResources, envSlug));
            StdApiRequest request = BuiltinSlug.request(slug, cmd.paramValues());
            runConfig.name(slug).kind(TaskKind.BUILTIN).stdApiRequest(request).paramValues(cmd.paramValues());
            run.taskId("")
                    .taskName(slug)
                    .kind(TaskKind.BUILTIN)
                    .stdApi(true)
                    .stdApiRequest(request)
                    .paramValues(cmd.paramValues());
        } else {
            TaskConfig task = local.get();
            Map<String, Object> params = applyDefaults(task.parameters(), cmd.paramValues());
            Map<String, ConfigVar> mergedConfigs = configs.mergedConfigs(envSlug);
            attachments.putAll(task.resources());
            runConfig.name(task.name())
                    .kind(task.kind())
                    .kindOptions(task.kindOptions())
                    .entrypoint(task.entrypoint())
                    .taskEnv(task.env())
                    .configVars(mergedConfigs)
                    .paramValues(params);
            run.taskId(slug)
                    .taskName(task.name())
                    .kind(task.kind())
                    .workflow(task.workflow())
                    .parameters(task.parameters())
                    .paramValues(params);
        }

        Map<String, Resource> aliasToResource = configs.aliasToResource(attachments, mergedResources, envSlug);
        runConfig.aliasToResource(aliasToResource);
        run.resources(ConfigService.aliasToId(aliasToResource));

        runs.add(slug, runId, run.build());
        log.info("Executing {} as run {}{}", slug, runId, parentId == null ? "" : " (parent " + parentId + ")");

        ExecutionResult result = executor.execute(runConfig.build());
        if (result.skipped()) {
            log.info("Run {} skipped: {}", runId, result.warning());
        }
        return result.run();
    }

    /**
     * A subscriber may already be following a pre-allocated run; end it as failed so the stream closes.
     */
    private void failPreallocated(String runId, RuntimeException cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        ObjectNode error = Json.mapper().createObjectNode().put("error", message);
        runs.update(runId, r -> r.isTerminal() ? r : r.finish(RunStatus.FAILED, error, Instant.now()));
        runs.logs(runId).close();
        log.warn("Run {} failed before it started: {}", runId, message);
    }

    private Run executeRemote(String slug, Map<String, Object> paramValues, String parentId, String envSlug) {
        if (envSlug == null) {
            throw new NotFoundException("task with slug \"" + slug + "\" is not registered locally");
        }
        String remoteRunId;
        try {
            remoteRunId = remote.runTask(slug, paramValues, envSlug);
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                throw new NotFoundException("task with slug \"" + slug
                        + "\" is not registered locally or remotely in environment \"" + envSlug + "\"");
            }
            throw e;
        }
        log.info("Task {} is not local, started remote run {} in env {}", slug, remoteRunId, envSlug);

        Run run = Run.builder()
                .id(remoteRunId)
                .status(RunStatus.ACTIVE)
                .createdAt(Instant.now())
                .taskId(slug)
                .taskName(slug)
                .parentId(parentId)
                .envSlug(envSlug)
                .paramValues(paramValues)
                .remote(true)
                .build();
        runs.add(slug, remoteRunId, run);
        // Remote logs are not streamed locally.
        runs.logs(remoteRunId).close();
        return run;
    }

    /**
     * The SDK names exactly one resource for a builtin, under the alias the builtin expects.
     */
    private static Map<String, String> builtinAttachment(Map<String, String> requested,
                                                         Map<String, Resource> mergedResources,
                                                         String envSlug) {
        if (requested.size() != 1) {
            throw new IllegalArgumentException(
                    "unable to determine resource required by builtin, there is not exactly one resource in request: "
                            + requested);
        }
        Map.Entry<String, String> only = requested.entrySet().iterator().next();
        for (Resource resource : mergedResources.values()) {
            if (only.getValue().equals(resource.id())) {
                return Map.of(only.getKey(), resource.slug());
            }
        }
        String message = "resource with id \"" + only.getValue() + "\" not found in dev config file";
        if (envSlug != null) {
            message += " or remotely in env \"" + envSlug + "\"";
        }
        throw new NotFoundException(message);
    }

    static Map<String, Object> applyDefaults(List<Parameter> parameters, Map<String, Object> values) {
        Map<String, Object> out = new LinkedHashMap<>(values);
        for (Parameter p : parameters) {
            if (p.defaultValue() != null && !out.containsKey(p.slug())) {
                out.put(p.slug(), p.defaultValue());
            }
        }
        return out;
    }

    /**
     * Register an empty run so log subscribers can attach before execution starts.
     */
    public String createRun() {
        String runId = IdGenerator.runId();
        runs.add(null, runId, Run.builder().id(runId).createdAt(Instant.now()).build());
        log.debug("Pre-allocated run {}", runId);
        return runId;
    }

    public Run getRun(String runId) {
        return runs.get(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public JsonNode getOutputs(String runId) {
        return getRun(runId).outputs();
    }

    public List<Run> listRuns(String taskSlug) {
        return runs.history(taskSlug);
    }

    public List<Run> descendants(String runId) {
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("runID cannot be empty");
        }
        return runs.descendants(runId);
    }

    public TaskMetadata getMetadata(String slug) {
        if (slug == null || slug.isEmpty()) {
            throw new IllegalArgumentException("expected a slug");
        }
        return TaskMetadata.local(slug);
    }

    /**
     * Mark a run cancelled and stop its process, if it has one.
     * Cancelling a finished run leaves it unchanged.
     */
    public Run cancel(String runId, String cancelledBy) {
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("runID cannot be empty");
        }
        Run run = runs.update(runId, r -> r.isTerminal()
                ? r
                : r.finish(RunStatus.CANCELLED, null, Instant.now()).toBuilder().cancelledBy(cancelledBy).build());
        if (run.status() != RunStatus.CANCELLED) {
            log.info("Run {} already finished as {}, not cancelling", runId, run.status());
            return run;
        }
        if (runs.triggerCancel(runId)) {
            log.info("Cancelled run {}, stopping its process", runId);
        } else {
            log.info("Cancelled run {} before its process started", runId);
        }
        return run;
    }

    // Prompts

    /**
     * Attach a prompt to a run and mark the run as waiting for the user.
     *
     * @return the prompt id
     */
    public String createPrompt(String runId, Prompt request) {
        Prompt.Reviewers reviewers = request.reviewers();
        reviewers = new Prompt.Reviewers(
                reviewers == null || reviewers.groups() == null ? List.of() : reviewers.groups(),
                reviewers == null || reviewers.users() == null ? List.of() : reviewers.users(),
                reviewers == null || reviewers.allowSelfApprovals() == null ? Boolean.TRUE : reviewers.allowSelfApprovals());
        Prompt prompt = new Prompt(IdGenerator.promptId(), runId, request.schema(),
                request.values() == null ? Map.of() : request.values(), reviewers,
                request.confirmText(), request.cancelText(), request.description(), Instant.now(), null, null);
        runs.update(runId, r -> r.toBuilder().addPrompt(prompt).waitingForUser(true).build());
        log.info("Run {} is waiting for prompt {}", runId, prompt.id());
        return prompt.id();
    }

    public Prompt getPrompt(String runId, String promptId) {
        if (promptId == null || promptId.isEmpty()) {
            throw new IllegalArgumentException("id is required");
        }
        return getRun(runId).prompts().stream()
                .filter(p -> p.id().equals(promptId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("prompt not found"));
    }

    public List<Prompt> listPrompts(String runId) {
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("runID is required");
        }
        return getRun(runId).prompts();
    }

    /**
     * Record the user's answer; the run keeps waiting while any prompt is unanswered.
     */
    public Prompt submitPrompt(String runId, String promptId, Map<String, Object> values) {
        if (promptId == null || promptId.isEmpty()) {
            throw new IllegalArgumentException("prompt ID is required");
        }
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("run ID is required");
        }
        Run updated = runs.update(runId, r -> {
            List<Prompt> prompts = new ArrayList<>(r.prompts());
            int index = -1;
            for (int i = 0; i < prompts.size(); i++) {
                if (prompts.get(i).id().equals(promptId)) {
                    index = i;
                }
            }
            if (index < 0) {
                throw new NotFoundException("prompt does not exist");
            }
            prompts.set(index, prompts.get(index).submit(
                    values == null ? Map.of() : values, authInfo.userId(), Instant.now()));
            boolean waiting = prompts.stream().anyMatch(p -> !p.isSubmitted());
            return r.toBuilder().prompts(prompts).waitingForUser(waiting).build();
        });
        return updated.prompts().stream().filter(p -> p.id().equals(promptId)).findFirst().orElseThrow();
    }

    // Displays

    /**
     * Attach a display to a run.
     *
     * @return the display id
     */
    public String createDisplay(String runId, Display request) {
        Instant now = Instant.now();
        String kind = request.kind();
        String content = null;
        List<JsonNode> rows = null;
        List<JsonNode> columns = null;
        JsonNode value = null;
        if ("markdown".equals(kind)) {
            content = request.content();
            if (content != null && content.length() > MAX_MARKDOWN_LENGTH) {
                throw new IllegalArgumentException("content too long: expected at most " + MAX_MARKDOWN_LENGTH
                        + " characters, got " + content.length());
            }
        } else if ("table".equals(kind)) {
            rows = request.rows();
            columns = request.columns();
            if (rows != null && rows.size() > MAX_TABLE_ROWS) {
                throw new IllegalArgumentException("too many table rows: expected at most " + MAX_TABLE_ROWS
                        + ", got " + rows.size());
            }
            if (columns != null && columns.size() > MAX_TABLE_COLUMNS) {
                throw new IllegalArgumentException("too many table columns: expected at most " + MAX_TABLE_COLUMNS
                        + ", got " + columns.size());
            }
        } else if ("json".equals(kind)) {
            value = request.value();
        }
        Display display = new Display(IdGenerator.displayId(), runId, kind, content, rows, columns, value, now, now);
        Run run = runs.update(runId, r -> r.toBuilder().addDisplay(display).build());
        log.info("[{} display] kind={}", run.taskId(), kind);
        return display.id();
    }

    public List<Display> listDisplays(String runId) {
        return getRun(runId).displays();
    }
}
