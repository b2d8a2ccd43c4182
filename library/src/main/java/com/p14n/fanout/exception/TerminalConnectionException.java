package com.p14n.fanout.exception;

/**
 * Reconnect attempts are exhausted. The connection stays disconnected until
 * {@code connect()} is called again.
 */
public class TerminalConnectionException extends FanoutException {

    private final int attempts;

    public TerminalConnectionException(int attempts) {
        super("Gave up reconnecting after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
