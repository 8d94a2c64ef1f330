package airdev.devserver.api.v0;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.v0.dto.RunResponse;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.HashMap;
import java.util.Map;

/**
 * Controller for run lookups (external API).
 *
 * GET /v0/runs/get?id= - A run, terminal or in flight
 * GET /v0/runs/getOutputs?id= - The run's output document
 * GET /v0/runs/list?taskSlug= - Run history of a task, most recent first
 */
public class RunController implements Controller {

    private static final String GET = "/v0/runs/get";
    private static final String GET_OUTPUTS = "/v0/runs/getOutputs";
    private static final String LIST = "/v0/runs/list";

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (GET.equals(path) || GET_OUTPUTS.equals(path) || LIST.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        switch (path) {
            case GET:
                return ControllerResponse.json(RunResponse.from(runService.getRun(Requests.query(req, "id"))));
            case GET_OUTPUTS:
                // Map.of rejects the null document of a run without outputs.
                Map<String, Object> outputs = new HashMap<>();
                outputs.put("output", runService.getOutputs(Requests.query(req, "id")));
                return ControllerResponse.json(outputs);
            default:
                String taskSlug = Requests.query(req, "taskSlug");
                return ControllerResponse.json(Map.of("runs", RunResponse.fromAll(runService.listRuns(taskSlug))));
        }
    }
}
