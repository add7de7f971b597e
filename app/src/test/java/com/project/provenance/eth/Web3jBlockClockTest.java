package com.project.provenance.eth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

import static org.junit.jupiter.api.Assertions.*;

class Web3jBlockClockTest {

    /**
     * Replays canned JSON-RPC responses instead of calling a node.
     */
    static class ScriptedService extends HttpService {
        private final Deque<String> responses = new ArrayDeque<>();

        ScriptedService height(long height) {
            responses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x" + Long.toHexString(height) + "\"}");
            return this;
        }

        ScriptedService rpcError(String message) {
            responses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"" + message + "\"}}");
            return this;
        }

        @Override
        protected InputStream performIO(String request) throws IOException {
            String next = responses.poll();
            if (next == null) {
                throw new IOException("connection refused");
            }
            return new ByteArrayInputStream(next.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("Reports node height and never goes backwards")
    void monotonicHeight() {
        ScriptedService service = new ScriptedService().height(16).height(12).height(32);
        Web3jBlockClock clock = new Web3jBlockClock(Web3j.build(service));

        assertEquals(16, clock.currentHeight());
        assertEquals(16, clock.currentHeight());
        assertEquals(32, clock.currentHeight());
    }

    @Test
    @DisplayName("RPC and transport failures surface as IllegalStateException")
    void failures() {
        ScriptedService service = new ScriptedService().rpcError("node syncing");
        Web3jBlockClock clock = new Web3jBlockClock(Web3j.build(service));

        IllegalStateException rpc = assertThrows(IllegalStateException.class, clock::currentHeight);
        assertTrue(rpc.getMessage().contains("node syncing"));

        IllegalStateException io = assertThrows(IllegalStateException.class, clock::currentHeight);
        assertInstanceOf(IOException.class, io.getCause());
    }
}
