package com.p14n.fanout.connection;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted transport. Each {@link #open} is recorded and left pending until the
 * test completes or fails it.
 */
public class FakeTransport implements Transport {

    public static class FakeSession implements TransportSession {
        public final List<String> sent = new CopyOnWriteArrayList<>();
        public volatile Integer closeCode;

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
        }
    }

    public static class Attempt {
        public final URI endpoint;
        public final TransportListener listener;
        public final CompletableFuture<TransportSession> future = new CompletableFuture<>();
        public final FakeSession session = new FakeSession();

        Attempt(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        public FakeSession open() {
            future.complete(session);
            return session;
        }

        public void fail(String message) {
            future.completeExceptionally(new IOException(message));
        }
    }

    public final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<TransportSession> open(URI endpoint, TransportListener listener) {
        Attempt attempt = new Attempt(endpoint, listener);
        attempts.add(attempt);
        return attempt.future;
    }

    public Attempt last() {
        return attempts.get(attempts.size() - 1);
    }
}
