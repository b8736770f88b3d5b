/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import com.postbox.utils.LoggerUtil;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles request frames from TCP segments that do not line up with frame boundaries.
 *
 * <p>A header may arrive split over several reads, and so may its payload. Bytes are
 * cumulated until a complete frame is available; each complete frame is handed back
 * in arrival order and anything left over waits for the next read.
 *
 * <p>This class encapsulates:
 * <ul>
 *   <li>Header parsing once 23 bytes are available</li>
 *   <li>Rejection of declared payloads above the configured ceiling</li>
 *   <li>Stall tracking, so a peer that stops mid-frame can be disconnected</li>
 * </ul>
 *
 * <h3>Usage Pattern:</h3>
 * <pre>
 * RequestFrameAccumulator accumulator = new RequestFrameAccumulator("[conn 7] ", maxPayload);
 *
 * // On each channelRead:
 * try {
 *     for (Request request : accumulator.append(newBytes, System.nanoTime())) {
 *         dispatch(ctx, request);
 *     }
 * } catch (FramingException e) {
 *     ctx.close();
 * }
 *
 * // On channelInactive:
 * int discarded = accumulator.clearAndReset();
 * </pre>
 *
 * <h3>Thread Safety:</h3>
 * Not thread-safe. One instance belongs to one channel and is only touched from that
 * channel's event loop.
 */
public class RequestFrameAccumulator {

    private final String logPrefix;
    private final long maxPayloadBytes;

    private ByteBuf cumulation = Unpooled.buffer(ProtocolConstants.REQUEST_HEADER_SIZE);
    private RequestHeader pendingHeader = null;
    private long lastProgressNanos = 0L;

    /**
     * @param logPrefix       prefix for diagnostic log lines (e.g., connection identifier)
     * @param maxPayloadBytes largest payload a header may declare before the frame is rejected
     */
    public RequestFrameAccumulator(String logPrefix, long maxPayloadBytes) {
        if (maxPayloadBytes < 0 || maxPayloadBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxPayloadBytes out of range: " + maxPayloadBytes);
        }
        this.logPrefix = logPrefix != null ? logPrefix : "";
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * Adds newly read bytes and extracts every frame they complete.
     *
     * @param newBytes  bytes from one readiness event
     * @param nowNanos  monotonic timestamp of the read, used for stall tracking
     * @return complete requests in arrival order (possibly empty)
     * @throws FramingException if a header declares a payload above the ceiling
     */
    public List<Request> append(byte[] newBytes, long nowNanos) throws FramingException {
        if (newBytes.length > 0) {
            cumulation.writeBytes(newBytes);
            lastProgressNanos = nowNanos;
        }

        List<Request> frames = new ArrayList<>();
        while (true) {
            if (pendingHeader == null) {
                if (cumulation.readableBytes() < ProtocolConstants.REQUEST_HEADER_SIZE) {
                    break;
                }
                RequestHeader header = WireCodec.decodeHeader(cumulation);
                if (header.payloadSize() > maxPayloadBytes) {
                    throw new FramingException(String.format(
                            "Declared payload of %d bytes exceeds limit of %d (opcode %d)",
                            header.payloadSize(), maxPayloadBytes, header.opcode()));
                }
                pendingHeader = header;
            }

            int payloadSize = (int) pendingHeader.payloadSize();
            if (cumulation.readableBytes() < payloadSize) {
                LoggerUtil.debug(() -> logPrefix + String.format(
                        "Awaiting payload: have %d of %d bytes", cumulation.readableBytes(), payloadSize));
                break;
            }

            byte[] payload = new byte[payloadSize];
            cumulation.readBytes(payload);
            frames.add(new Request(pendingHeader, payload));
            pendingHeader = null;
        }

        cumulation.discardSomeReadBytes();
        return frames;
    }

    /**
     * Checks whether a partially received frame has seen no new bytes for at least {@code timeoutNanos}.
     */
    public boolean isStalled(long nowNanos, long timeoutNanos) {
        return hasBufferedData() && nowNanos - lastProgressNanos >= timeoutNanos;
    }

    /**
     * Nanoseconds left before the buffered partial frame counts as stalled (zero or less if already stalled).
     */
    public long remainingBeforeStall(long nowNanos, long timeoutNanos) {
        return timeoutNanos - (nowNanos - lastProgressNanos);
    }

    /**
     * Clears all buffered state and releases the cumulation buffer.
     * Should be called on channel inactive.
     *
     * @return number of bytes discarded (useful for logging)
     */
    public int clearAndReset() {
        int discarded = getBufferedByteCount();
        cumulation.release();
        cumulation = Unpooled.buffer(ProtocolConstants.REQUEST_HEADER_SIZE);
        pendingHeader = null;
        lastProgressNanos = 0L;
        return discarded;
    }

    /**
     * @return true if part of a frame (header bytes or an incomplete payload) is waiting
     */
    public boolean hasBufferedData() {
        return pendingHeader != null || cumulation.isReadable();
    }

    /**
     * @return bytes of the current partial frame, counting an already parsed header as 23 bytes
     */
    public int getBufferedByteCount() {
        return (pendingHeader != null ? ProtocolConstants.REQUEST_HEADER_SIZE : 0) + cumulation.readableBytes();
    }

    /**
     * @return true once a header has been parsed and its payload is still incomplete
     */
    public boolean isAwaitingPayload() {
        return pendingHeader != null;
    }
}
