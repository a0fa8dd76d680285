package com.catalogizer.smb;

import com.catalogizer.core.source.SourceEndpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SocketSourceConnectorTest {

    private final SocketSourceConnector connector = new SocketSourceConnector();

    private static SourceEndpoint endpoint(String path) {
        return new SourceEndpoint("nas", path, null, null, null);
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("smb URL without port uses 445")
        void smbDefaultPort() throws Exception {
            InetSocketAddress address = SocketSourceConnector.resolve("smb://127.0.0.1/media");
            assertEquals("127.0.0.1", address.getHostString());
            assertEquals(445, address.getPort());
        }

        @Test
        @DisplayName("explicit port wins")
        void explicitPort() throws Exception {
            assertEquals(1445, SocketSourceConnector.resolve("smb://127.0.0.1:1445/media").getPort());
        }

        @Test
        @DisplayName("UNC paths in either slash style are smb")
        void uncPaths() throws Exception {
            assertEquals(445, SocketSourceConnector.resolve("//127.0.0.1/media").getPort());
            assertEquals(445, SocketSourceConnector.resolve("\\\\127.0.0.1\\media\\My Photos").getPort());
        }

        @Test
        @DisplayName("other schemes use their well-known port")
        void otherSchemes() throws Exception {
            assertEquals(21, SocketSourceConnector.resolve("ftp://127.0.0.1/pub").getPort());
            assertEquals(2049, SocketSourceConnector.resolve("nfs://127.0.0.1/export").getPort());
            assertEquals(443, SocketSourceConnector.resolve("https://127.0.0.1/dav").getPort());
        }

        @Test
        @DisplayName("paths without a host are rejected")
        void rejectsMissingHost() {
            assertThrows(IOException.class, () -> SocketSourceConnector.resolve(""));
            assertThrows(IOException.class, () -> SocketSourceConnector.resolve("/local/dir"));
            assertThrows(IOException.class, () -> SocketSourceConnector.resolve("gopher://127.0.0.1/x"));
        }
    }

    @Test
    @DisplayName("connects and probes a listening port")
    void connectsToListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            String path = "smb://127.0.0.1:" + server.getLocalPort() + "/share";

            assertDoesNotThrow(() -> connector.connect(endpoint(path), Duration.ofSeconds(2)));
            assertDoesNotThrow(() -> connector.probe(endpoint(path), Duration.ofSeconds(2)));
        }
    }

    @Test
    @DisplayName("fails when nothing is listening")
    void failsWhenClosed() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        String path = "smb://127.0.0.1:" + port + "/share";

        assertThrows(IOException.class, () -> connector.connect(endpoint(path), Duration.ofSeconds(2)));
    }
}
