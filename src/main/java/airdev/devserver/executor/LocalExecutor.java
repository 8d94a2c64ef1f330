package airdev.devserver.executor;

import airdev.devserver.builtins.BuiltinClient;
import airdev.devserver.env.EnvVarResolver;
import airdev.devserver.env.TaskEnvRequest;
import airdev.devserver.env.TemplateInterpolator;
import airdev.devserver.logs.ErrorScanner;
import airdev.devserver.logs.LogBroker;
import airdev.devserver.model.LogItem;
import airdev.devserver.model.LogLevel;
import airdev.devserver.model.Resource;
import airdev.devserver.model.Run;
import airdev.devserver.model.RunStatus;
import airdev.devserver.outputs.OutputDocument;
import airdev.devserver.outputs.OutputParser;
import airdev.devserver.outputs.OutputProtocolException;
import airdev.devserver.outputs.ParsedLine;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.repository.RunRepository;
import airdev.devserver.runtime.PrepareOptions;
import airdev.devserver.runtime.PreparedRun;
import airdev.devserver.runtime.RuntimeRegistry;
import airdev.devserver.runtime.TaskRuntime;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks as local processes and records their logs and outputs.
 *
 * Per run: resolve the command and env, start the process, drain stdout and stderr on two
 * scan loops, wait for exit and finalize the run in the registry. The output document and the
 * parser's chunk buffers are shared by both loops under one per-run lock. The run's log broker
 * is closed on every path.
 */
public class LocalExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutor.class);

    private final RunRepository runs;
    private final RuntimeRegistry runtimes;
    private final EnvVarResolver envResolver;
    private final RemoteApiClient remote;
    private final BuiltinClient builtins;
    private final int maxOutputLineBytes;
    private final Duration killGrace;
    private final ExecutorService scanPool;

    public LocalExecutor(RunRepository runs,
                         RuntimeRegistry runtimes,
                         EnvVarResolver envResolver,
                         RemoteApiClient remote,
                         BuiltinClient builtins,
                         int maxOutputLineBytes,
                         Duration killGrace) {
        this.runs = runs;
        this.runtimes = runtimes;
        this.envResolver = envResolver;
        this.remote = remote;
        this.builtins = builtins;
        this.maxOutputLineBytes = maxOutputLineBytes;
        this.killGrace = killGrace;
        AtomicInteger threadCount = new AtomicInteger();
        this.scanPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "airdev-scan-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Execute one registered run and finalize it.
     * Blocks until the process exits; never throws for task failures.
     *
     * @throws airdev.devserver.repository.RunNotFoundException if the run is not registered
     */
    public ExecutionResult execute(LocalRunConfig config) {
        String runId = config.runId();
        LogBroker broker = runs.logs(runId);
        RunState state = new RunState(config, broker, maxOutputLineBytes);
        try {
            return run(state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.completed(finish(state, RunStatus.FAILED, "interrupted while running task"));
        } catch (Exception e) {
            log.warn("Run {} of task {} failed: {}", runId, config.slug(), e.getMessage());
            log.debug("Run {} failure", runId, e);
            return ExecutionResult.completed(finish(state, RunStatus.FAILED, e.getMessage()));
        } finally {
            broker.close();
        }
    }

    private ExecutionResult run(RunState state) throws IOException, InterruptedException {
        LocalRunConfig config = state.config;

        Map<String, String> configValues = new LinkedHashMap<>();
        config.configVars().forEach((name, cv) -> configValues.put(name, cv.value()));
        TemplateInterpolator interpolator = new TemplateInterpolator(remote, TemplateInterpolator.baseRequest(
                config.runId(), config.parentRunId(), config.slug(), config.paramValues(),
                configValues, config.aliasToResource()));

        Map<String, Resource> resources = interpolator.interpolateResources(config.aliasToResource());

        PreparedRun prepared;
        Path root = null;
        if (config.isBuiltin()) {
            prepared = new PreparedRun(builtins.command(config.stdApiRequest()), null);
        } else {
            TaskRuntime runtime = runtimes.lookup(config.entrypoint(), config.kind());
            if (!runtime.supportsLocalExecution()) {
                return skip(state);
            }
            Map<String, Object> kindOptions = interpolator.interpolateKindOptions(config.kindOptions());
            prepared = runtime.prepare(new PrepareOptions(config.entrypoint(), config.paramValues(),
                    kindOptions, config.slug(), config.runId(), builtins));
            root = config.entrypoint() == null ? prepared.workingDir() : runtime.root(config.entrypoint());
            if (root == null) {
                root = Path.of("").toAbsolutePath();
            }
        }

        List<String> env = envResolver.resolveTask(envRequest(config, root, resources), interpolator);

        ProcessBuilder pb = new ProcessBuilder(prepared.command());
        if (prepared.workingDir() != null) {
            pb.directory(prepared.workingDir().toFile());
        }
        Map<String, String> processEnv = pb.environment();
        processEnv.clear();
        for (String entry : env) {
            int eq = entry.indexOf('=');
            processEnv.put(entry.substring(0, eq), entry.substring(eq + 1));
        }

        if (!activate(config.runId())) {
            log.info("Run {} was cancelled before its process started", config.runId());
            return ExecutionResult.completed(runs.get(config.runId()).orElseThrow());
        }

        log.info("Locally running task [{}] ({})", config.name(), config.runId());
        log.debug("Running {}", String.join(" ", prepared.command()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("starting: " + e.getMessage(), e);
        }
        runs.onCancel(config.runId(), () -> killTree(process));
        if (runs.get(config.runId()).map(Run::isTerminal).orElse(false)) {
            // Cancelled between activation and hook installation.
            killTree(process);
        }

        // Stdin is unused; closing it lets tasks that read it see EOF.
        process.getOutputStream().close();

        CompletableFuture<Void> stdout = CompletableFuture.runAsync(
                () -> scan(state, process.getInputStream()), scanPool);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(
                () -> scan(state, process.getErrorStream()), scanPool);

        String scanError = awaitScan(stdout);
        String stderrError = awaitScan(stderr);
        if (scanError == null) {
            scanError = stderrError;
        }

        int exit;
        try {
            exit = process.waitFor();
        } catch (InterruptedException e) {
            killTree(process);
            throw e;
        }
        log.info("Finished running task [{}] ({}) with exit code {}", config.name(), config.runId(), exit);

        if (exit == 0 && scanError == null) {
            return ExecutionResult.completed(finish(state, RunStatus.SUCCEEDED, null));
        }
        String error = scanError != null ? scanError : "waiting: exit status " + exit;
        return ExecutionResult.completed(finish(state, RunStatus.FAILED, error));
    }

    private ExecutionResult skip(RunState state) {
        LocalRunConfig config = state.config;
        String kind = config.kind() == null ? "unknown" : config.kind().wireName();
        String warning = "Local execution is not supported for task " + config.slug() + " (kind=" + kind + ")";
        log.warn(warning);
        state.record(warning, LogLevel.WARN);
        Run run = runs.update(config.runId(), r -> r.isTerminal() ? r : r.finish(RunStatus.SUCCEEDED, null, Instant.now()));
        return ExecutionResult.skipped(run, warning);
    }

    /**
     * Move the run to Active unless it was cancelled meanwhile.
     */
    private boolean activate(String runId) {
        Run run = runs.update(runId, r -> r.isTerminal() ? r : r.toBuilder().status(RunStatus.ACTIVE).build());
        return !run.isTerminal();
    }

    private void scan(RunState state, InputStream stream) {
        try (InputStream in = new BufferedInputStream(stream)) {
            String line;
            while ((line = readLine(in)) != null) {
                handleLine(state, line);
            }
        } catch (IOException e) {
            throw new ScanException("scanning logs: " + e.getMessage(), e);
        }
    }

    /**
     * Next line split on {@code \n} only, without a trailing {@code \r}.
     * A lone {@code \r} stays inside the line.
     *
     * @return the line, or null at end of stream
     */
    static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1 && b != '\n') {
            buf.write(b);
        }
        if (b == -1 && buf.size() == 0) {
            return null;
        }
        byte[] bytes = buf.toByteArray();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
            len--;
        }
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }

    void handleLine(RunState state, String line) {
        String hint = ErrorScanner.hint(line);
        if (hint != null) {
            log.info("[{}] {}", state.config.slug(), hint);
        }

        synchronized (state.outputLock) {
            try {
                Optional<ParsedLine> parsed = state.parser.parse(line);
                if (parsed.isPresent()) {
                    state.document.apply(parsed.get());
                }
            } catch (OutputProtocolException e) {
                log.error("[outputs] {}", e.getMessage());
            }
        }

        log.info("[{} log] {}", state.config.name(), line);
        state.record(line, LogLevel.INFO);
    }

    private static String awaitScan(CompletableFuture<Void> loop) throws InterruptedException {
        try {
            loop.get();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Log scan failed: {}", cause.getMessage());
            return cause.getMessage();
        }
    }

    /**
     * Store the terminal status. A run already finalized (cancelled) keeps its status;
     * failed runs without outputs get {@code {"error": message}}.
     */
    private Run finish(RunState state, RunStatus status, String error) {
        JsonNode produced;
        synchronized (state.outputLock) {
            produced = state.document.snapshot();
        }
        JsonNode outputs = produced;
        if (status == RunStatus.FAILED && outputs == null) {
            ObjectNode errorOutput = JsonNodeFactory.instance.objectNode();
            errorOutput.put("error", error == null ? "" : error);
            outputs = errorOutput;
        }
        JsonNode finalOutputs = outputs;
        Instant now = Instant.now();
        return runs.update(state.config.runId(), r -> {
            if (r.isTerminal()) {
                return produced == null ? r : r.toBuilder().outputs(produced).build();
            }
            return r.finish(status, finalOutputs, now);
        });
    }

    private TaskEnvRequest envRequest(LocalRunConfig config, Path root, Map<String, Resource> resources) {
        return TaskEnvRequest.builder()
                .runId(config.runId())
                .parentRunId(config.parentRunId())
                .taskSlug(config.slug())
                .taskName(config.name())
                .taskEnv(config.taskEnv())
                .devConfigEnv(config.devConfigEnv())
                .configVars(config.configVars())
                .fallbackEnvSlug(config.fallbackEnvSlug())
                .root(root)
                .entrypoint(config.entrypoint())
                .authInfo(config.authInfo())
                .apiHost(config.apiHost())
                .taskUrl(config.taskUrl())
                .runUrl(config.runUrl())
                .aliasToResource(resources)
                .tunnelToken(config.tunnelToken())
                .build();
    }

    /**
     * Terminate a process and its descendants; force-kill whatever is left after the grace period.
     */
    void killTree(Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.info("Terminating process {}", process.pid());
        List<ProcessHandle> children = process.descendants().toList();
        children.forEach(ProcessHandle::destroy);
        process.destroy();
        CompletableFuture.delayedExecutor(killGrace.toMillis(), TimeUnit.MILLISECONDS, scanPool).execute(() -> {
            children.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
            if (process.isAlive()) {
                log.warn("Process {} did not exit after {}, killing it", process.pid(), killGrace);
                process.destroyForcibly();
            }
        });
    }

    @Override
    public void close() {
        scanPool.shutdown();
        try {
            if (!scanPool.awaitTermination(5, TimeUnit.SECONDS)) {
                scanPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            scanPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Scan-loop failure carried out of the loop's future. */
    static final class ScanException extends RuntimeException {
        ScanException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Mutable per-run state shared by the two scan loops. */
    static final class RunState {
        final LocalRunConfig config;
        final LogBroker broker;
        final Object outputLock = new Object();
        final OutputParser parser;
        final OutputDocument document = new OutputDocument();
        private final Object recordLock = new Object();
        private long insertId;

        RunState(LocalRunConfig config, LogBroker broker, int maxOutputLineBytes) {
            this.config = config;
            this.broker = broker;
            this.parser = new OutputParser(maxOutputLineBytes);
        }

        /** Stdout and stderr both record here; ids and timestamps follow delivery order. */
        void record(String text, LogLevel level) {
            synchronized (recordLock) {
                broker.record(new LogItem(Instant.now(), ++insertId, text, level, config.slug()));
            }
        }
    }
}
