package com.p14n.fanout.vertx;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import com.p14n.fanout.connection.Transport;
import com.p14n.fanout.connection.TransportListener;
import com.p14n.fanout.connection.TransportSession;

import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link TransportSession}s over a Vert.x WebSocket client. Accepts
 * {@code ws}, {@code wss}, {@code http} and {@code https} endpoints.
 */
public class VertxWebSocketTransport implements Transport, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VertxWebSocketTransport.class);

    private final WebSocketClient client;

    public VertxWebSocketTransport(Vertx vertx) {
        this(vertx, new WebSocketClientOptions());
    }

    public VertxWebSocketTransport(Vertx vertx, WebSocketClientOptions options) {
        this.client = vertx.createWebSocketClient(options);
    }

    static WebSocketConnectOptions connectOptions(URI endpoint) {
        String scheme = endpoint.getScheme() == null ? "ws" : endpoint.getScheme().toLowerCase();
        boolean ssl = scheme.equals("wss") || scheme.equals("https");
        int port = endpoint.getPort() != -1 ? endpoint.getPort() : (ssl ? 443 : 80);
        String path = endpoint.getRawPath() == null || endpoint.getRawPath().isEmpty() ? "/" : endpoint.getRawPath();
        String uri = endpoint.getRawQuery() == null ? path : path + "?" + endpoint.getRawQuery();
        return new WebSocketConnectOptions()
                .setHost(endpoint.getHost())
                .setPort(port)
                .setSsl(ssl)
                .setURI(uri);
    }

    @Override
    public CompletableFuture<TransportSession> open(URI endpoint, TransportListener listener) {
        CompletableFuture<TransportSession> result = new CompletableFuture<>();
        WebSocketConnectOptions options;
        try {
            options = connectOptions(endpoint);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return result;
        }

        logger.atDebug()
                .addArgument(options.getHost())
                .addArgument(options.getPort())
                .log("Opening WebSocket to {}:{}");

        client.connect(options).onComplete(ar -> {
            if (ar.failed()) {
                logger.atDebug()
                        .addArgument(options.getHost())
                        .setCause(ar.cause())
                        .log("WebSocket to {} could not be opened");
                result.completeExceptionally(ar.cause());
                return;
            }
            WebSocket ws = ar.result();
            ws.textMessageHandler(listener::onText);
            ws.exceptionHandler(listener::onError);
            ws.closeHandler(v -> {
                Short code = ws.closeStatusCode();
                listener.onClose(code == null ? TransportSession.ABNORMAL_CLOSURE : code, ws.closeReason());
            });
            result.complete(new VertxSession(ws));
        });
        return result;
    }

    @Override
    public void close() {
        client.close();
    }

    private static class VertxSession implements TransportSession {

        private final WebSocket ws;

        VertxSession(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public void send(String text) {
            ws.writeTextMessage(text).onFailure(e -> logger.atWarn()
                    .setCause(e)
                    .log("Failed to write WebSocket frame"));
        }

        @Override
        public void close(int code, String reason) {
            ws.close((short) code, reason);
        }
    }
}
