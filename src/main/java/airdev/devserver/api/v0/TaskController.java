package airdev.devserver.api.v0;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.v0.dto.ExecuteTaskRequest;
import airdev.devserver.api.v0.dto.RunResponse;
import airdev.devserver.model.Run;
import airdev.devserver.service.ExecuteCommand;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Controller for task execution (external API).
 *
 * POST /v0/tasks/execute - Run a task and wait for it to finish
 * GET /v0/tasks/getMetadata?slug= - Deterministic id of a task
 */
public class TaskController implements Controller {

    private static final String EXECUTE = "/v0/tasks/execute";
    private static final String GET_METADATA = "/v0/tasks/getMetadata";

    private final RunService runService;

    public TaskController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && EXECUTE.equals(path))
                || (method.equals(HttpMethod.GET) && GET_METADATA.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (EXECUTE.equals(path)) {
            return handleExecute(req);
        }
        return ControllerResponse.json(runService.getMetadata(Requests.query(req, "slug")));
    }

    private ControllerResponse handleExecute(FullHttpRequest req) {
        ExecuteTaskRequest request = Requests.body(req, ExecuteTaskRequest.class);
        request.validate();

        Run run = runService.execute(new ExecuteCommand(
                request.runId(),
                request.slug(),
                request.paramValues(),
                request.resources(),
                Requests.callerRunId(req),
                Requests.envSlug(req)));

        return ControllerResponse.json(RunResponse.from(run));
    }
}
