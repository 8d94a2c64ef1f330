package airdev.devserver.api.v0;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.v0.dto.IdResponse;
import airdev.devserver.model.Prompt;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * Prompts created by running tasks. The calling run is identified by its run token.
 *
 * POST /v0/prompts/create
 * GET /v0/prompts/get?id=
 */
public class PromptController implements Controller {

    private static final String CREATE = "/v0/prompts/create";
    private static final String GET = "/v0/prompts/get";

    private final RunService runService;

    public PromptController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && CREATE.equals(path))
                || (method.equals(HttpMethod.GET) && GET.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String runId = Requests.requireCallerRunId(req);
        if (CREATE.equals(path)) {
            Prompt request = Requests.body(req, Prompt.class);
            return ControllerResponse.json(new IdResponse(runService.createPrompt(runId, request)));
        }
        Prompt prompt = runService.getPrompt(runId, Requests.query(req, "id"));
        return ControllerResponse.json(Map.of("prompt", prompt));
    }
}
