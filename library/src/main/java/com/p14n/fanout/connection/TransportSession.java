package com.p14n.fanout.connection;

/**
 * An open socket session.
 */
public interface TransportSession {

    int NORMAL_CLOSURE = 1000;
    int ABNORMAL_CLOSURE = 1006;

    void send(String text);

    void close(int code, String reason);
}
