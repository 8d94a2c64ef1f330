package airdev.devserver.api.internal;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Requests;
import airdev.devserver.service.ViewService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /i/views/get?slug= - A local view with the env its bundle runs with
 */
public class ViewController implements Controller {

    private static final String GET = "/i/views/get";

    private final ViewService viewService;

    public ViewController(ViewService viewService) {
        this.viewService = viewService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && GET.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(viewService.getView(Requests.query(req, "slug"), Requests.envSlug(req)));
    }
}
