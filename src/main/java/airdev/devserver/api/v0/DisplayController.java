package airdev.devserver.api.v0;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.v0.dto.CreateDisplayRequest;
import airdev.devserver.api.v0.dto.IdResponse;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * POST /v0/displays/create - Attach a display to the calling run
 * GET /v0/displays/list?runID= - Displays of a run
 */
public class DisplayController implements Controller {

    private static final String CREATE = "/v0/displays/create";
    private static final String LIST = "/v0/displays/list";

    private final RunService runService;

    public DisplayController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && CREATE.equals(path))
                || (method.equals(HttpMethod.GET) && LIST.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (CREATE.equals(path)) {
            String runId = Requests.requireCallerRunId(req);
            CreateDisplayRequest request = Requests.body(req, CreateDisplayRequest.class);
            request.validate();
            return ControllerResponse.json(new IdResponse(runService.createDisplay(runId, request.display())));
        }
        return ControllerResponse.json(Map.of("displays", runService.listDisplays(Requests.query(req, "runID"))));
    }
}
