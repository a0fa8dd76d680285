package com.catalogizer.core.connection;

import com.catalogizer.core.source.SourceEndpoint;

import java.io.IOException;
import java.time.Duration;

/**
 * Protocol client for a remote endpoint. Implementations open or verify the connection
 * and should give up once {@code timeout} has elapsed; the caller enforces the same
 * deadline independently.
 */
public interface SourceConnector {

    /**
     * Establishes connectivity with the endpoint.
     *
     * @throws IOException if the endpoint cannot be reached or refuses the connection
     */
    void connect(SourceEndpoint endpoint, Duration timeout) throws IOException;

    /**
     * Lightweight check that a previously connected endpoint is still reachable.
     *
     * @throws IOException if the endpoint no longer answers
     */
    void probe(SourceEndpoint endpoint, Duration timeout) throws IOException;
}
