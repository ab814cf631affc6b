package apprunner.common.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
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
 * Netty HTTP server hosting one {@link RouterHandler}.
 * Used by both the balancer and the worker.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    /** Patches carry whole source files */
    private static final int MAX_CONTENT_LENGTH = 8 * 1024 * 1024;

    /** Controllers may block on JDBC or on calls to workers */
    public static final int DEFAULT_HANDLER_THREADS = 16;

    private final String name;
    private final RouterHandler router;
    private final int ioThreads;
    private final int handlerThreads;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;

    public HttpServer(String name, RouterHandler router) {
        this(name, router, 0, DEFAULT_HANDLER_THREADS);
    }

    /**
     * @param ioThreads      event loop threads, 0 for Netty's default
     * @param handlerThreads threads running the router, off the event loops
     */
    public HttpServer(String name, RouterHandler router, int ioThreads, int handlerThreads) {
        if (ioThreads < 0 || handlerThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be >= 0 and handlerThreads >= 1");
        }
        this.name = name;
        this.router = router;
        this.ioThreads = ioThreads;
        this.handlerThreads = handlerThreads;
    }

    /** HTTP pipeline: codec, aggregation, routing on the handler group */
    ChannelHandler pipelineInitializer(EventExecutorGroup handlers) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(handlers, router);
            }
        };
    }

    public synchronized boolean start(String host, int port) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup(ioThreads);
            handlerGroup = new DefaultEventExecutorGroup(handlerThreads);

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(handlerGroup));

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("{} started on http://{}:{}", name, host, port);
            return true;
        } catch (Throwable t) {
            log.error("{} failed to start on port {}: {}", name, port, t.getMessage(), t);
            stop();
            return false;
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
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                handlerGroup = null;
            }
            if (running) {
                log.info("{} stopped", name);
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
