package airdev.devserver.api;

import airdev.devserver.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back, or {@link ControllerResponse#streamed()} if the controller
     *         writes to the channel itself
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final ControllerResponse STREAMED = new ControllerResponse(null, null, null);

        public static ControllerResponse json(Object value) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", Json.write(value));
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    Json.write(Map.of("error", message == null ? "" : message)));
        }

        /** The studio is served from another origin, so every response allows any origin. */
        public static void addCorsHeaders(HttpHeaders headers) {
            headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
            headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "*");
            headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS");
        }

        /** The controller has taken over the channel; the router writes nothing. */
        public static ControllerResponse streamed() {
            return STREAMED;
        }

        public boolean isStreamed() {
            return this == STREAMED;
        }
    }
}
