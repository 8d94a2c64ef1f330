package airdev.devserver.api.dev;

import airdev.devserver.api.Controller;
import airdev.devserver.logs.LogWatcher;
import airdev.devserver.model.LogItem;
import airdev.devserver.repository.RunRepository;
import airdev.devserver.util.Json;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /dev/logs/{runId} - Server-sent events, one {@link LogItem} per event.
 *
 * <p>Buffered history is sent first, then live lines. The stream ends when the run's logs are
 * complete or the client goes away.
 */
public class LogStreamController implements Controller, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogStreamController.class);

    private static final Pattern LOGS_PATTERN = Pattern.compile("^/dev/logs/([^/]+)$");

    private final RunRepository runs;
    private final ExecutorService streams = Executors.newCachedThreadPool(
            new DefaultThreadFactory("log-stream", true));

    public LogStreamController(RunRepository runs) {
        this.runs = runs;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && LOGS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = LOGS_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("Not found");
        }
        String runId = m.group(1);
        // Throws RunNotFoundException before anything is written.
        LogWatcher watcher = runs.logs(runId).newWatcher();

        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream");
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        response.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        ControllerResponse.addCorsHeaders(response.headers());

        Channel channel = ctx.channel();
        channel.writeAndFlush(response);
        channel.closeFuture().addListener(f -> watcher.close());

        streams.execute(() -> drain(runId, watcher, channel));
        return ControllerResponse.streamed();
    }

    private void drain(String runId, LogWatcher watcher, Channel channel) {
        log.debug("Streaming logs of run {}", runId);
        int sent = 0;
        try {
            Optional<LogItem> item;
            while ((item = watcher.next()).isPresent()) {
                if (!channel.isActive()) {
                    break;
                }
                String event = "data: " + Json.write(item.get()) + "\n\n";
                channel.writeAndFlush(new DefaultHttpContent(
                        Unpooled.copiedBuffer(event, StandardCharsets.UTF_8)));
                sent++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            watcher.close();
            if (channel.isActive()) {
                channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT)
                        .addListener(ChannelFutureListener.CLOSE);
            }
            log.debug("Log stream of run {} ended after {} events", runId, sent);
        }
    }

    @Override
    public void close() {
        streams.shutdownNow();
    }
}
