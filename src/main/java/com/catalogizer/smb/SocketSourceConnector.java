package com.catalogizer.smb;

import com.catalogizer.core.connection.SourceConnector;
import com.catalogizer.core.source.SourceEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Connector that only checks TCP reachability of a source's host and port.
 * <p>
 * Accepted path forms: {@code smb://host[:port]/share}, {@code //host/share} and
 * {@code \\host\share}. Other URI schemes resolve to their well-known port.
 */
public class SocketSourceConnector implements SourceConnector {

    private static final Logger log = LoggerFactory.getLogger(SocketSourceConnector.class);

    private static final Map<String, Integer> DEFAULT_PORTS = Map.of(
            "smb", 445,
            "ftp", 21,
            "nfs", 2049,
            "http", 80,
            "webdav", 80,
            "https", 443
    );

    @Override
    public void connect(SourceEndpoint endpoint, Duration timeout) throws IOException {
        InetSocketAddress address = resolve(endpoint.path());
        log.debug("Connecting to {} for source {}", address, endpoint.sourceId());
        open(address, timeout);
    }

    @Override
    public void probe(SourceEndpoint endpoint, Duration timeout) throws IOException {
        open(resolve(endpoint.path()), timeout);
    }

    private static void open(InetSocketAddress address, Duration timeout) throws IOException {
        if (address.isUnresolved()) {
            throw new IOException("unknown host: " + address.getHostString());
        }
        try (Socket socket = new Socket()) {
            socket.connect(address, (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis())));
        }
    }

    /**
     * Extracts host and port from a source path.
     *
     * @throws IOException if the path names no host
     */
    static InetSocketAddress resolve(String path) throws IOException {
        if (path == null || path.isBlank()) {
            throw new IOException("empty source path");
        }
        String normalized = path.trim().replace('\\', '/').replace(" ", "%20");
        if (normalized.startsWith("//")) {
            normalized = "smb:" + normalized;
        }

        URI uri;
        try {
            uri = new URI(normalized);
        } catch (URISyntaxException e) {
            throw new IOException("invalid source path: " + path, e);
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IOException("no host in source path: " + path);
        }
        String scheme = uri.getScheme() == null ? "smb" : uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port < 0) {
            Integer known = DEFAULT_PORTS.get(scheme);
            if (known == null) {
                throw new IOException("unsupported scheme '" + scheme + "' without explicit port: " + path);
            }
            port = known;
        }
        return new InetSocketAddress(host, port);
    }
}
