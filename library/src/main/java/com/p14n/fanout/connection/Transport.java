package com.p14n.fanout.connection;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens socket sessions for a {@link ConnectionManager}.
 */
public interface Transport {

    /**
     * Opens a session. The listener receives everything that happens on the
     * session after the returned future completes.
     *
     * @param endpoint the endpoint, including any token query parameter
     * @param listener receives inbound frames, errors and the close
     * @return completes with the open session, or exceptionally if it could not
     *         be opened
     */
    CompletableFuture<TransportSession> open(URI endpoint, TransportListener listener);
}
