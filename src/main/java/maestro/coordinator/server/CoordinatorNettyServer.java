package maestro.coordinator.server;

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
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import maestro.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * HTTP and WebSocket front end of the coordinator.
 * <p>
 * REST requests go through the shared {@link RouterHandler}; {@code /ws}
 * upgrades to a WebSocket whose connection becomes an observer.
 */
public final class CoordinatorNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final Dependencies deps;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public CoordinatorNettyServer(Dependencies deps) {
        this.deps = deps;
    }

    ChannelInitializer<SocketChannel> pipelineInitializer() {
        RouterHandler router = deps.routerHandler();
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH));
                p.addLast(new WebSocketFrameHandler(deps.observerBridge()));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind the configured host and port. Port 0 binds an ephemeral port, see {@link #port()}.
     */
    public synchronized void start() {
        if (serverChannel != null) {
            return;
        }
        String host = deps.config().serverHost();
        int port = deps.config().serverPort();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());
            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            log.info("Coordinator listening on {}:{}", host, port());
        } catch (RuntimeException e) {
            log.error("Failed to start coordinator on {}:{}", host, port, e);
            stop();
            throw e;
        }
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /** The bound port, or -1 when not running. */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /** Block until the server channel closes. */
    public void awaitTermination() {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().syncUninterruptibly();
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            log.info("Coordinator stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
