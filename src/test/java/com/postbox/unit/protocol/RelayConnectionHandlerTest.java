/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.unit.protocol;

import com.postbox.db.models.Client;
import com.postbox.db.models.ClientId;
import com.postbox.protocol.ProtocolConstants;
import com.postbox.protocol.RelayConnectionHandler;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.ResponseCode;
import com.postbox.protocol.WireCodec;
import com.postbox.protocol.core.RequestDispatcher;
import com.postbox.storage.RelayStore;
import com.postbox.storage.StorageException;
import com.postbox.storage.impl.InMemoryRelayStore;
import com.postbox.support.ClientFrames;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RelayConnectionHandler - framing, dispatch and connection lifecycle.
 *
 * Tests critical functionality:
 * - One response per request, in order
 * - Buffering of headers and payloads split across reads
 * - Framing errors close the connection without a response
 * - Rejected requests keep the connection open
 */
@DisplayName("RelayConnectionHandler Tests")
class RelayConnectionHandlerTest {

    private static final int VERSION = 2;
    private static final long MAX_PAYLOAD = 64 * 1024;
    private static final long STALL_TIMEOUT_MS = 30_000;

    private InMemoryRelayStore store;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelayStore();
        channel = newChannel(RequestDispatcher.withDefaultHandlers(store), STALL_TIMEOUT_MS);
    }

    @AfterEach
    void tearDown() {
        if (channel != null && channel.isOpen()) {
            channel.finishAndReleaseAll();
        }
        store.close();
    }

    private static EmbeddedChannel newChannel(RequestDispatcher dispatcher, long stallTimeoutMs) {
        return new EmbeddedChannel(new RelayConnectionHandler(dispatcher, VERSION, MAX_PAYLOAD, stallTimeoutMs));
    }

    private void send(byte[] bytes) {
        channel.writeInbound(Unpooled.wrappedBuffer(bytes));
    }

    private byte[] readResponse() {
        ByteBuf out = channel.readOutbound();
        assertNotNull(out, "expected a response");
        return WireCodec.toBytes(out);
    }

    private static int responseCode(byte[] response) {
        return (response[1] & 0xFF) | (response[2] & 0xFF) << 8;
    }

    private static byte[] registration(String username) {
        byte[] key = new byte[ProtocolConstants.PUBLIC_KEY_SIZE];
        Arrays.fill(key, (byte) username.length());
        return ClientFrames.encodeRequest(ClientId.of(new byte[16]), VERSION, RequestCode.REGISTER.getValue(),
                ClientFrames.encodeRegistrationPayload(username, key));
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Should answer a registration with version, 2100 and the new id")
        void shouldAnswerRegistration() {
            send(registration("alice"));

            byte[] response = readResponse();
            assertEquals(ProtocolConstants.RESPONSE_HEADER_SIZE + 16, response.length);
            assertEquals(VERSION, response[0]);
            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(response));
            assertTrue(store.getClientByUsername("alice").isPresent());
        }

        @Test
        @DisplayName("Should answer coalesced requests one by one in order")
        void shouldAnswerCoalescedRequests() {
            byte[] first = registration("alice");
            byte[] second = registration("bob");
            byte[] both = Arrays.copyOf(first, first.length + second.length);
            System.arraycopy(second, 0, both, first.length, second.length);

            send(both);

            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(readResponse()));
            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(readResponse()));
            assertNull(channel.readOutbound());
            assertEquals(2, store.listClients().size());
        }

        @Test
        @DisplayName("Should keep the connection open after an error response")
        void shouldStayOpenAfterError() {
            send(registration("alice"));
            readResponse();

            send(registration("alice"));
            byte[] error = readResponse();
            assertArrayEquals(new byte[]{VERSION, 0x28, 0x23, 0, 0, 0, 0}, error);
            assertTrue(channel.isOpen());

            send(registration("bob"));
            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(readResponse()));
        }

        @Test
        @DisplayName("Should stamp the requester's last-seen time after answering")
        void shouldUpdateLastSeen() {
            send(registration("alice"));
            ClientId alice = ClientId.of(Arrays.copyOfRange(readResponse(), 7, 23));
            assertEquals(Client.LAST_SEEN_UNAVAILABLE, store.getClientById(alice).orElseThrow().lastSeen());

            send(ClientFrames.encodeRequest(alice, VERSION, RequestCode.LIST_CLIENTS.getValue(), new byte[0]));
            readResponse();

            assertNotEquals(Client.LAST_SEEN_UNAVAILABLE, store.getClientById(alice).orElseThrow().lastSeen());
        }
    }

    @Nested
    @DisplayName("Buffering")
    class BufferingTests {

        @Test
        @DisplayName("Should wait for the rest of a split header before answering")
        void shouldBufferSplitHeader() {
            byte[] frame = registration("alice");

            send(Arrays.copyOfRange(frame, 0, 10));
            assertNull(channel.readOutbound());
            assertTrue(channel.isOpen());

            send(Arrays.copyOfRange(frame, 10, frame.length));
            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(readResponse()));
        }

        @Test
        @DisplayName("Should wait for a payload delivered in several reads")
        void shouldBufferSplitPayload() {
            byte[] frame = registration("alice");

            send(Arrays.copyOfRange(frame, 0, 100));
            send(Arrays.copyOfRange(frame, 100, 300));
            assertNull(channel.readOutbound());

            send(Arrays.copyOfRange(frame, 300, frame.length));
            assertEquals(ResponseCode.REGISTRATION_SUCCESS.getValue(), responseCode(readResponse()));
        }

        @Test
        @DisplayName("Should send nothing when the peer closes mid-header")
        void shouldDiscardPartialFrameOnClose() {
            send(new byte[12]);

            channel.close();

            assertNull(channel.readOutbound());
            assertTrue(store.listClients().isEmpty());
        }

        @Test
        @DisplayName("Should close a connection whose partial frame stalls")
        void shouldCloseStalledConnection() throws InterruptedException {
            channel.finishAndReleaseAll();
            channel = newChannel(RequestDispatcher.withDefaultHandlers(store), 1);

            send(Arrays.copyOfRange(registration("alice"), 0, 40));
            Thread.sleep(50);
            channel.runScheduledPendingTasks();

            assertFalse(channel.isOpen());
            assertNull(channel.readOutbound());
        }
    }

    @Nested
    @DisplayName("Framing Errors")
    class FramingErrorTests {

        @Test
        @DisplayName("Should close without a response on an unknown opcode")
        void shouldCloseOnUnknownOpcode() {
            send(ClientFrames.encodeRequest(ClientId.random(), VERSION, 999, new byte[0]));

            assertNull(channel.readOutbound());
            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("Should close without a response when the declared payload is too large")
        void shouldCloseOnOversizedPayload() {
            byte[] header = Arrays.copyOf(ClientFrames.encodeRequest(
                    ClientId.random(), VERSION, RequestCode.SEND_MESSAGE.getValue(), new byte[0]), 23);
            header[22] = 0x7F;  // ~2 GiB declared

            send(header);

            assertNull(channel.readOutbound());
            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("Should not answer requests queued behind a framing error")
        void shouldDropRequestsAfterFramingError() {
            byte[] bad = ClientFrames.encodeRequest(ClientId.random(), VERSION, 1, new byte[0]);
            byte[] good = registration("alice");
            byte[] both = Arrays.copyOf(bad, bad.length + good.length);
            System.arraycopy(good, 0, both, bad.length, good.length);

            send(both);

            assertNull(channel.readOutbound());
            assertTrue(store.listClients().isEmpty());
        }

        @Test
        @DisplayName("Should close the connection when the store fails")
        void shouldCloseOnStorageFailure() {
            RelayStore failing = mock(RelayStore.class);
            when(failing.listClients()).thenThrow(new StorageException("disk gone"));
            channel.finishAndReleaseAll();
            channel = newChannel(RequestDispatcher.withDefaultHandlers(failing), STALL_TIMEOUT_MS);

            send(ClientFrames.encodeRequest(ClientId.random(), VERSION, RequestCode.LIST_CLIENTS.getValue(), new byte[0]));

            assertNull(channel.readOutbound());
            assertFalse(channel.isOpen());
        }
    }
}
