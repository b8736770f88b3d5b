/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.server;

import com.postbox.protocol.ProtocolConstants;
import com.postbox.protocol.RelayConnectionHandler;
import com.postbox.protocol.core.RequestDispatcher;
import com.postbox.utils.LoggerUtil;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Properties;

/**
 * TCP front end of the relay.
 *
 * <p>One boss thread accepts connections; a worker event loop group (a single loop unless
 * {@code server.worker.threads} says otherwise) owns every accepted socket and runs each
 * request to completion. All connections share one {@link RequestDispatcher}.
 */
public class PostboxServer {

    /** SLF4J logger name of the per-connection traffic dump. */
    public static final String TRAFFIC_LOGGER = "INBOUND";

    private static final String SIMPLE_LOGGER_LEVEL_PREFIX = "org.slf4j.simpleLogger.log.";

    private static final int DEFAULT_BACKLOG = 100;
    private static final int DEFAULT_WORKER_THREADS = 1;
    private static final int MAX_WORKER_THREADS = 256;
    private static final long DEFAULT_MAX_PAYLOAD_BYTES = 16L * 1024 * 1024;
    private static final long DEFAULT_STALL_TIMEOUT_MS = 30_000L;

    private final int port;
    private final String bindAddr;
    private final int backlog;
    private final int workerThreads;
    private final int serverVersion;
    private final long maxPayloadBytes;
    private final long stallTimeoutMs;
    private final RequestDispatcher dispatcher;

    private final ChannelGroup activeChannels = new DefaultChannelGroup("postbox-clients", GlobalEventExecutor.INSTANCE);

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public PostboxServer(int port, Properties config, RequestDispatcher dispatcher) {
        this.port = port;
        this.bindAddr = config.getProperty("bind.address", "0.0.0.0").trim();
        this.backlog = (int) parseLong(config, "server.backlog", DEFAULT_BACKLOG, 1, Integer.MAX_VALUE);
        this.workerThreads = (int) parseLong(config, "server.worker.threads", DEFAULT_WORKER_THREADS, 1, MAX_WORKER_THREADS);
        this.serverVersion = (int) parseLong(config, "server.version", ProtocolConstants.DEFAULT_SERVER_VERSION, 0, 0xFF);
        this.maxPayloadBytes = parseLong(config, "frame.max.payload.bytes", DEFAULT_MAX_PAYLOAD_BYTES, 0, Integer.MAX_VALUE);
        this.stallTimeoutMs = parseLong(config, "frame.stall.timeout.ms", DEFAULT_STALL_TIMEOUT_MS, 1, Long.MAX_VALUE);
        this.dispatcher = dispatcher;
    }

    /**
     * Lets Netty's traffic dump through the slf4j-simple binding, which otherwise stays at WARN.
     * Must run before the first connection is accepted; slf4j-simple reads levels once per logger.
     */
    public static void enableTrafficLogging() {
        System.setProperty(SIMPLE_LOGGER_LEVEL_PREFIX + TRAFFIC_LOGGER, "debug");
    }

    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(workerThreads);

        try {
            ServerBootstrap sb = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, backlog)
                    .childHandler(new ChannelInitializer<Channel>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ch.pipeline().addLast("tracker", new ChannelTracker());
                            ch.pipeline().addLast("logger-in", new LoggingHandler(TRAFFIC_LOGGER, LogLevel.DEBUG));
                            ch.pipeline().addLast("relay", new RelayConnectionHandler(
                                    dispatcher, serverVersion, maxPayloadBytes, stallTimeoutMs));
                        }
                    })
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true);

            LoggerUtil.info("Binding " + bindAddr + ":" + port + " ...");
            ChannelFuture bindFuture = sb.bind(bindAddr, port).sync();
            serverChannel = bindFuture.channel();
            LoggerUtil.info("Server ready on " + bindAddr + ":" + getBoundPort()
                    + " | version=" + serverVersion + " | backlog=" + backlog + " | workers=" + workerThreads);

        } catch (Exception e) {
            if (bossGroup != null) bossGroup.shutdownGracefully();
            if (workerGroup != null) workerGroup.shutdownGracefully();
            throw e;
        }
    }

    /**
     * @return the port actually bound (differs from the requested one when it was 0), or -1 before start
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        try {
            if (serverChannel != null && serverChannel.isOpen()) serverChannel.close().sync();
            activeChannels.close().awaitUninterruptibly();
            if (bossGroup != null) bossGroup.shutdownGracefully().sync();
            if (workerGroup != null) workerGroup.shutdownGracefully().sync();
            LoggerUtil.info("Server stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Interrupted while stopping: " + e.getMessage());
        } catch (Exception e) {
            LoggerUtil.error("Error stopping: " + e.getMessage());
        }
    }

    /**
     * Adds each channel to the active group once connected; the group drops it on close.
     */
    private final class ChannelTracker extends ChannelInboundHandlerAdapter {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            activeChannels.add(ctx.channel());
            super.channelActive(ctx);
        }
    }

    /**
     * Reads a numeric setting, warning and falling back to the default when it is
     * not a number or lies outside [min, max].
     */
    private static long parseLong(Properties config, String key, long defaultValue, long min, long max) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed >= min && parsed <= max) {
                return parsed;
            }
            LoggerUtil.warn("Value for " + key + " out of range [" + min + ", " + max + "]: " + value
                    + ", using default: " + defaultValue);
        } catch (NumberFormatException e) {
            LoggerUtil.warn("Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
        }
        return defaultValue;
    }
}
