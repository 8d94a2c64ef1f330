package airdev.devserver.server;

import airdev.devserver.api.Controller;
import airdev.devserver.api.Controller.ControllerResponse;
import airdev.devserver.remote.RemoteApiException;
import airdev.devserver.repository.RunNotFoundException;
import airdev.devserver.service.NotFoundException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * <ul>
 *   <li>/v0/* - API used by tasks and the CLI</li>
 *   <li>/i/* - API used by the studio UI</li>
 *   <li>/dev/* - dev server specific endpoints</li>
 * </ul>
 *
 * Errors are returned as {@code {"error": "..."}}. This handler is @Sharable because it has no
 * per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        // The studio is served from another origin.
        if (method.equals(HttpMethod.OPTIONS)) {
            writeSafe(ctx, OK, "text/plain", "");
            return;
        }

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    if (!response.isStreamed()) {
                        writeSafe(ctx, response.status(), response.contentType(), response.body());
                    }
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, "not found");

        } catch (NotFoundException | RunNotFoundException e) {
            log.debug("Not found: {} {} - {}", method, path, e.getMessage());
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {} {} - {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (RemoteApiException e) {
            log.warn("Remote API error: {} {} - {}", method, path, e.getMessage());
            writeError(ctx, e.isNotFound() ? NOT_FOUND : INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {} - Body: [{}]", method, path,
                    req.content().toString(StandardCharsets.UTF_8), t);

            StringBuilder errorChain = new StringBuilder(t.toString());
            Throwable cause = t.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            writeError(ctx, INTERNAL_SERVER_ERROR, errorChain.toString());
        }
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        ControllerResponse response = ControllerResponse.error(status, message);
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Write a full response. If that fails, fall back to a plain 500 and close the connection
     * only when even that cannot be written.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ControllerResponse.addCorsHeaders(response.headers());
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"error\":\"failed to write response\"}".getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }
}
