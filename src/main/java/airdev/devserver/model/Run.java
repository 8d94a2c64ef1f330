package airdev.devserver.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one execution attempt of a task.
 * State changes go through {@link #toBuilder()} inside a registry update.
 */
public final class Run {
    private final String id;
    private final RunStatus status;
    private final JsonNode outputs; // null until the run produced or failed with an output
    private final Instant createdAt;
    private final String creatorId;
    private final Instant succeededAt;
    private final Instant failedAt;
    private final Instant cancelledAt;
    private final String cancelledBy;
    private final Map<String, Object> paramValues;
    private final List<Parameter> parameters;
    private final String parentId;
    private final String taskId; // slug for local tasks, empty for builtins
    private final String taskName;
    private final TaskKind kind;
    private final String envSlug;
    private final List<Display> displays;
    private final List<Prompt> prompts;
    private final boolean waitingForUser;
    private final Map<String, String> resources; // alias -> resource id
    private final boolean stdApi;
    private final StdApiRequest stdApiRequest;
    private final boolean remote;
    private final boolean workflow; // task declared runtime: workflow

    private Run(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.outputs = builder.outputs;
        this.createdAt = builder.createdAt;
        this.creatorId = builder.creatorId;
        this.succeededAt = builder.succeededAt;
        this.failedAt = builder.failedAt;
        this.cancelledAt = builder.cancelledAt;
        this.cancelledBy = builder.cancelledBy;
        this.paramValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.paramValues));
        this.parameters = List.copyOf(builder.parameters);
        this.parentId = builder.parentId;
        this.taskId = builder.taskId;
        this.taskName = builder.taskName;
        this.kind = builder.kind;
        this.envSlug = builder.envSlug;
        this.displays = List.copyOf(builder.displays);
        this.prompts = List.copyOf(builder.prompts);
        this.waitingForUser = builder.waitingForUser;
        this.resources = Map.copyOf(builder.resources);
        this.stdApi = builder.stdApi;
        this.stdApiRequest = builder.stdApiRequest;
        this.remote = builder.remote;
        this.workflow = builder.workflow;
    }

    // Getters
    public String id() {
        return id;
    }

    public RunStatus status() {
        return status;
    }

    public JsonNode outputs() {
        return outputs;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String creatorId() {
        return creatorId;
    }

    public Instant succeededAt() {
        return succeededAt;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public Instant cancelledAt() {
        return cancelledAt;
    }

    public String cancelledBy() {
        return cancelledBy;
    }

    public Map<String, Object> paramValues() {
        return paramValues;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public String parentId() {
        return parentId;
    }

    public String taskId() {
        return taskId;
    }

    public String taskName() {
        return taskName;
    }

    public TaskKind kind() {
        return kind;
    }

    public String envSlug() {
        return envSlug;
    }

    public List<Display> displays() {
        return displays;
    }

    public List<Prompt> prompts() {
        return prompts;
    }

    public boolean waitingForUser() {
        return waitingForUser;
    }

    public Map<String, String> resources() {
        return resources;
    }

    public boolean stdApi() {
        return stdApi;
    }

    public StdApiRequest stdApiRequest() {
        return stdApiRequest;
    }

    public boolean remote() {
        return remote;
    }

    public boolean workflow() {
        return workflow;
    }

    /** Check if run is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Move to a terminal status, stamping the matching timestamp.
     * Outputs are replaced only when given.
     */
    public Run finish(RunStatus terminal, JsonNode finalOutputs, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        Builder b = toBuilder().status(terminal);
        if (finalOutputs != null) {
            b.outputs(finalOutputs);
        }
        switch (terminal) {
            case SUCCEEDED -> b.succeededAt(at);
            case FAILED -> b.failedAt(at);
            case CANCELLED -> b.cancelledAt(at);
            default -> throw new IllegalStateException();
        }
        return b.build();
    }

    /** Create a builder from this run (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .outputs(outputs)
                .createdAt(createdAt)
                .creatorId(creatorId)
                .succeededAt(succeededAt)
                .failedAt(failedAt)
                .cancelledAt(cancelledAt)
                .cancelledBy(cancelledBy)
                .paramValues(paramValues)
                .parameters(parameters)
                .parentId(parentId)
                .taskId(taskId)
                .taskName(taskName)
                .kind(kind)
                .envSlug(envSlug)
                .displays(displays)
                .prompts(prompts)
                .waitingForUser(waitingForUser)
                .resources(resources)
                .stdApi(stdApi)
                .stdApiRequest(stdApiRequest)
                .remote(remote)
                .workflow(workflow);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private RunStatus status = RunStatus.QUEUED;
        private JsonNode outputs;
        private Instant createdAt;
        private String creatorId;
        private Instant succeededAt;
        private Instant failedAt;
        private Instant cancelledAt;
        private String cancelledBy;
        private Map<String, Object> paramValues = Map.of();
        private List<Parameter> parameters = List.of();
        private String parentId;
        private String taskId;
        private String taskName;
        private TaskKind kind;
        private String envSlug;
        private List<Display> displays = List.of();
        private List<Prompt> prompts = List.of();
        private boolean waitingForUser;
        private Map<String, String> resources = Map.of();
        private boolean stdApi;
        private StdApiRequest stdApiRequest;
        private boolean remote;
        private boolean workflow;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder outputs(JsonNode outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder creatorId(String creatorId) {
            this.creatorId = creatorId;
            return this;
        }

        public Builder succeededAt(Instant succeededAt) {
            this.succeededAt = succeededAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder cancelledAt(Instant cancelledAt) {
            this.cancelledAt = cancelledAt;
            return this;
        }

        public Builder cancelledBy(String cancelledBy) {
            this.cancelledBy = cancelledBy;
            return this;
        }

        public Builder paramValues(Map<String, Object> paramValues) {
            this.paramValues = paramValues == null ? Map.of() : paramValues;
            return this;
        }

        public Builder parameters(List<Parameter> parameters) {
            this.parameters = parameters == null ? List.of() : parameters;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder envSlug(String envSlug) {
            this.envSlug = envSlug;
            return this;
        }

        public Builder displays(List<Display> displays) {
            this.displays = displays == null ? List.of() : displays;
            return this;
        }

        public Builder addDisplay(Display display) {
            List<Display> next = new ArrayList<>(displays);
            next.add(display);
            this.displays = next;
            return this;
        }

        public Builder prompts(List<Prompt> prompts) {
            this.prompts = prompts == null ? List.of() : prompts;
            return this;
        }

        public Builder addPrompt(Prompt prompt) {
            List<Prompt> next = new ArrayList<>(prompts);
            next.add(prompt);
            this.prompts = next;
            return this;
        }

        public Builder waitingForUser(boolean waitingForUser) {
            this.waitingForUser = waitingForUser;
            return this;
        }

        public Builder resources(Map<String, String> resources) {
            this.resources = resources == null ? Map.of() : resources;
            return this;
        }

        public Builder stdApi(boolean stdApi) {
            this.stdApi = stdApi;
            return this;
        }

        public Builder stdApiRequest(StdApiRequest stdApiRequest) {
            this.stdApiRequest = stdApiRequest;
            return this;
        }

        public Builder remote(boolean remote) {
            this.remote = remote;
            return this;
        }

        public Builder workflow(boolean workflow) {
            this.workflow = workflow;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }
}
