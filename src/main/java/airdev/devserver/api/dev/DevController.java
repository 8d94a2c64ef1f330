package airdev.devserver.api.dev;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.api.dev.dto.EnvVarDto;
import airdev.devserver.service.ConfigService;
import airdev.devserver.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Endpoints used by the CLI and studio against the dev server itself.
 *
 * GET /dev/ping
 * POST /dev/runs/create
 * GET /dev/envVars/get?name=
 * GET /dev/envVars/list
 * POST /dev/envVars/upsert
 * POST /dev/envVars/delete
 */
public class DevController implements Controller {

    private static final String PING = "/dev/ping";
    private static final String CREATE_RUN = "/dev/runs/create";
    private static final String GET_ENV_VAR = "/dev/envVars/get";
    private static final String LIST_ENV_VARS = "/dev/envVars/list";
    private static final String UPSERT_ENV_VAR = "/dev/envVars/upsert";
    private static final String DELETE_ENV_VAR = "/dev/envVars/delete";

    private static final Set<String> GET_PATHS = Set.of(PING, GET_ENV_VAR, LIST_ENV_VARS);
    private static final Set<String> POST_PATHS = Set.of(CREATE_RUN, UPSERT_ENV_VAR, DELETE_ENV_VAR);

    private final RunService runService;
    private final ConfigService configService;

    public DevController(RunService runService, ConfigService configService) {
        this.runService = runService;
        this.configService = configService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && GET_PATHS.contains(path))
                || (method.equals(HttpMethod.POST) && POST_PATHS.contains(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        switch (path) {
            case PING:
                return ControllerResponse.json(Map.of());
            case CREATE_RUN:
                return ControllerResponse.json(Map.of("runID", runService.createRun()));
            case GET_ENV_VAR: {
                String name = Requests.query(req, "name");
                return ControllerResponse.json(Map.of("envVar", new EnvVarDto(name, configService.envVar(name))));
            }
            case LIST_ENV_VARS: {
                List<EnvVarDto> envVars = new ArrayList<>();
                configService.envVars().forEach((name, value) -> envVars.add(new EnvVarDto(name, value)));
                return ControllerResponse.json(Map.of("envVars", envVars));
            }
            case UPSERT_ENV_VAR: {
                EnvVarDto request = Requests.body(req, EnvVarDto.class);
                configService.upsertEnvVar(request.name(), request.value() == null ? "" : request.value());
                return ControllerResponse.json(Map.of());
            }
            default: {
                EnvVarDto request = Requests.body(req, EnvVarDto.class);
                configService.deleteEnvVar(request.name());
                return ControllerResponse.json(Map.of());
            }
        }
    }
}
