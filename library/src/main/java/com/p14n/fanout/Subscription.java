package com.p14n.fanout;

/**
 * Handle returned by every subscribe operation. Cancelling is synchronous and
 * idempotent: the second and later calls do nothing.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Stops delivery to the subscribed callback immediately.
     */
    void unsubscribe();

    /**
     * Returns whether this subscription has not been cancelled yet.
     *
     * @return true while active
     */
    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
