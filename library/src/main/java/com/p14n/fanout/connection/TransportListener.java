package com.p14n.fanout.connection;

/**
 * Callbacks from an open {@link TransportSession}.
 */
public interface TransportListener {

    void onText(String text);

    /**
     * @param code   the close code, {@link TransportSession#NORMAL_CLOSURE} for a
     *               clean close
     * @param reason the close reason, may be null
     */
    void onClose(int code, String reason);

    void onError(Throwable error);
}
