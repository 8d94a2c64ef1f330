package airdev.devserver.api.internal;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.internal.dto.CancelRunRequest;
import airdev.devserver.api.internal.dto.SubmitPromptRequest;
import airdev.devserver.api.v0.dto.IdResponse;
import airdev.devserver.api.v0.dto.RunResponse;
import airdev.devserver.model.Prompt;
import airdev.devserver.model.Run;
import airdev.devserver.remote.AuthInfo;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Endpoints the studio UI uses to follow and steer runs.
 *
 * GET /i/runs/getDescendants?runID=
 * POST /i/runs/cancel
 * GET /i/prompts/list?runID=
 * POST /i/prompts/submit
 * GET /i/displays/list?runID=
 */
public class RunInternalController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunInternalController.class);

    private static final String GET_DESCENDANTS = "/i/runs/getDescendants";
    private static final String CANCEL = "/i/runs/cancel";
    private static final String LIST_PROMPTS = "/i/prompts/list";
    private static final String SUBMIT_PROMPT = "/i/prompts/submit";
    private static final String LIST_DISPLAYS = "/i/displays/list";

    private static final Set<String> GET_PATHS = Set.of(GET_DESCENDANTS, LIST_PROMPTS, LIST_DISPLAYS);
    private static final Set<String> POST_PATHS = Set.of(CANCEL, SUBMIT_PROMPT);

    private final RunService runService;
    private final AuthInfo authInfo;

    public RunInternalController(RunService runService, AuthInfo authInfo) {
        this.runService = runService;
        this.authInfo = authInfo;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && GET_PATHS.contains(path))
                || (method.equals(HttpMethod.POST) && POST_PATHS.contains(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        switch (path) {
            case GET_DESCENDANTS:
                return ControllerResponse.json(Map.of("descendants",
                        RunResponse.fromAll(runService.descendants(Requests.query(req, "runID")))));
            case CANCEL: {
                CancelRunRequest request = Requests.body(req, CancelRunRequest.class);
                String by = authInfo.userId().isEmpty() ? null : authInfo.userId();
                Run run = runService.cancel(request.runId(), by);
                log.debug("Cancel requested for run {}, now {}", run.id(), run.status());
                return ControllerResponse.json(RunResponse.from(run));
            }
            case LIST_PROMPTS:
                return ControllerResponse.json(Map.of("prompts", runService.listPrompts(Requests.query(req, "runID"))));
            case SUBMIT_PROMPT: {
                SubmitPromptRequest request = Requests.body(req, SubmitPromptRequest.class);
                Prompt prompt = runService.submitPrompt(request.runId(), request.id(), request.values());
                return ControllerResponse.json(new IdResponse(prompt.id()));
            }
            default:
                return ControllerResponse.json(Map.of("displays", runService.listDisplays(Requests.query(req, "runID"))));
        }
    }
}
