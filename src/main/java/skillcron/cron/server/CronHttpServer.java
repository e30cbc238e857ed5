package skillcron.cron.server;

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
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the REST API.
 *
 * Request handling runs on a separate executor group because a manual run
 * blocks until the skill finishes; the I/O event loops must stay free.
 */
public final class CronHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CronHttpServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int HANDLER_THREADS = 16;

    private final RouterHandler router;
    private final String host;
    private final int port;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public CronHttpServer(RouterHandler router, String host, int port) {
        this.router = router;
        this.host = host;
        this.port = port;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(handlerGroup, router);
                        }
                    });

            serverChannel = b.bind(host, port).sync().channel();
            log.info("HTTP server listening on {}:{}", host, port);
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
        } finally {
            serverChannel = null;
            shutdownGroups();
            log.info("HTTP server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void shutdownGroups() {
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
    }
}
