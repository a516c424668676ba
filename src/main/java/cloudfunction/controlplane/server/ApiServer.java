package cloudfunction.controlplane.server;

import cloudfunction.common.NamedThreadFactory;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.core.ApiLayer;
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
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the {@link RouterHandler}. Controllers block on
 * function invocations for as long as a function runs, so each request is handed to an
 * unbounded request pool; a busy project never holds up requests for other projects.
 */
public final class ApiServer implements ApiLayer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final ControlPlaneConfig config;
    private final RouterHandler router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService requestPool;
    private volatile Channel serverChannel;

    public ApiServer(ControlPlaneConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
    }

    @Override
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        requestPool = Executors.newCachedThreadPool(new NamedThreadFactory("api-request-"));
        router.dispatchOn(requestPool);
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(300, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(10 * 1024 * 1024));
                            p.addLast("router", router);
                        }
                    });
            serverChannel = b.bind(config.serverHost(), config.serverPort()).sync().channel();
            log.info("API server listening on {}:{}", config.serverHost(), boundPort());
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
    }

    @Override
    public boolean isReady() {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    /**
     * Actual listening port (differs from the configured one when that is 0).
     */
    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    @Override
    public synchronized void stop() {
        if (serverChannel == null && bossGroup == null) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (requestPool != null) {
                requestPool.shutdownNow();
                requestPool = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
        }
        log.info("API server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
