package airdev.devserver.server;

import airdev.devserver.config.DevServerConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty HTTP server in front of a {@link RouterHandler}.
 *
 * <p>Task execution blocks until the run finishes, so the router runs on its own executor
 * group rather than on the I/O event loop.
 */
public final class DevServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DevServer.class);

    private static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024;
    private static final int HANDLER_THREADS = 64;

    private final DevServerConfig config;
    private final RouterHandler router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public DevServer(DevServerConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
    }

    /**
     * Bind and start serving.
     *
     * @return the bound port, which differs from the configured one when that is 0
     */
    public synchronized int start() throws InterruptedException {
        if (serverChannel != null) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);

        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(handlerGroup, router);
                    }
                });

        try {
            serverChannel = b.bind(config.serverHost(), config.serverPort()).sync().channel();
        } catch (Exception e) {
            stop();
            throw e;
        }
        log.info("Dev server listening on {}:{}", config.serverHost(), port());
        return port();
    }

    public synchronized int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("server is not running");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully();
                handlerGroup = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            log.info("Dev server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
