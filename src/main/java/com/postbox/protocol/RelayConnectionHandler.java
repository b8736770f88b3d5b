/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import com.postbox.protocol.core.RequestDispatcher;
import com.postbox.storage.RelayStore;
import com.postbox.utils.LoggerUtil;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-connection protocol handler.
 *
 * <p>Reassembles request frames, runs each through the shared {@link RequestDispatcher},
 * writes exactly one response per frame and then stamps the requester's last-seen time.
 * Framing problems (unknown opcode, oversized payload, stalled partial frame) close the
 * connection without a response. A rejected request produces the error response and the
 * connection stays open.
 */
public class RelayConnectionHandler extends ChannelInboundHandlerAdapter {

    private static final AtomicInteger NEXT_CONN_ID = new AtomicInteger(1);

    private final int connectionId = NEXT_CONN_ID.getAndIncrement();

    private final RequestDispatcher dispatcher;
    private final RelayStore store;
    private final int serverVersion;
    private final long stallTimeoutNanos;
    private final RequestFrameAccumulator accumulator;

    private ScheduledFuture<?> stallCheck;

    public RelayConnectionHandler(RequestDispatcher dispatcher, int serverVersion,
                                  long maxPayloadBytes, long stallTimeoutMs) {
        this.dispatcher = dispatcher;
        this.store = dispatcher.getStore();
        this.serverVersion = serverVersion;
        this.stallTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(stallTimeoutMs);
        this.accumulator = new RequestFrameAccumulator(prefix(), maxPayloadBytes);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        LoggerUtil.info(prefix() + "Connection ESTABLISHED | remote=" + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelStallCheck();

        int discardedBytes = accumulator.clearAndReset();
        if (discardedBytes > 0) {
            LoggerUtil.warn(prefix() + String.format(
                    "Connection closed with %d bytes of an incomplete request buffered", discardedBytes));
        }
        LoggerUtil.info(prefix() + "Connection CLOSED");
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LoggerUtil.error(prefix() + "Pipeline error: " + cause);
        ctx.close();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        final ByteBuf buf = (ByteBuf) msg;
        final byte[] in = new byte[buf.readableBytes()];
        try {
            buf.readBytes(in);
        } finally {
            buf.release();
        }

        try {
            List<Request> requests = accumulator.append(in, System.nanoTime());
            for (Request request : requests) {
                if (!ctx.channel().isActive()) {
                    return;
                }
                handleRequest(ctx, request);
            }
        } catch (FramingException e) {
            LoggerUtil.warn(prefix() + "Framing error, closing connection: " + e.getMessage());
            ctx.close();
            return;
        }

        if (accumulator.hasBufferedData()) {
            scheduleStallCheck(ctx, stallTimeoutNanos);
        } else {
            cancelStallCheck();
        }
    }

    private void handleRequest(ChannelHandlerContext ctx, Request request) throws FramingException {
        RequestHeader header = request.header();
        Optional<RequestCode> code = RequestCode.fromWire(header.opcode());
        if (code.isEmpty()) {
            throw new FramingException("Unknown opcode " + header.opcode()
                    + " from client " + header.clientId().toHex());
        }

        LoggerUtil.debug(() -> prefix() + String.format("Request %s | client=%s | version=%d | payload=%d",
                code.get(), header.clientId().toHex(), header.version(), header.payloadSize()));

        Response response = dispatcher.dispatch(code.get(), request);
        ctx.writeAndFlush(WireCodec.encodeResponse(response, serverVersion));

        LoggerUtil.debug(() -> prefix() + String.format("Response %d | payload=%d",
                response.code().getValue(), response.isError() ? 0 : response.payload().length));

        store.updateLastSeen(header.clientId());
    }

    private void scheduleStallCheck(ChannelHandlerContext ctx, long delayNanos) {
        if (stallCheck != null && !stallCheck.isDone()) {
            return;
        }
        stallCheck = ctx.executor().schedule(() -> checkStall(ctx), delayNanos, TimeUnit.NANOSECONDS);
    }

    private void checkStall(ChannelHandlerContext ctx) {
        stallCheck = null;
        if (!ctx.channel().isActive() || !accumulator.hasBufferedData()) {
            return;
        }
        long now = System.nanoTime();
        if (accumulator.isStalled(now, stallTimeoutNanos)) {
            LoggerUtil.warn(prefix() + String.format(
                    "Incomplete request stalled for %d ms (%d bytes buffered), closing connection",
                    TimeUnit.NANOSECONDS.toMillis(stallTimeoutNanos), accumulator.getBufferedByteCount()));
            ctx.close();
        } else {
            scheduleStallCheck(ctx, accumulator.remainingBeforeStall(now, stallTimeoutNanos));
        }
    }

    private void cancelStallCheck() {
        if (stallCheck != null) {
            stallCheck.cancel(false);
            stallCheck = null;
        }
    }

    private String prefix() {
        return "[conn " + connectionId + "] ";
    }
}
