package com.p14n.fanout.broker;

/**
 * Keyed delivery of messages to subscribers. Keys are opaque to the broker;
 * the fan-out layer uses scope keys such as {@code org:42}.
 *
 * <p>
 * Implementations must be safe for concurrent publish, subscribe and
 * unsubscribe. A message published to a key nobody subscribes to is dropped.
 * </p>
 *
 * @param <InT>  type published to the broker
 * @param <OutT> type handed to subscribers, see {@link #convert(Object)}
 */
public interface MessageBroker<InT, OutT> {

    void publish(String key, InT message);

    /**
     * @return false when the subscriber was already registered for the key
     */
    boolean subscribe(String key, MessageSubscriber<OutT> subscriber);

    /**
     * Removes a subscriber. The key is forgotten once its last subscriber
     * leaves.
     *
     * @return false when the subscriber was not registered for the key
     */
    boolean unsubscribe(String key, MessageSubscriber<OutT> subscriber);

    boolean hasSubscribers(String key);

    /**
     * Drops every subscriber. Publishing or subscribing afterwards fails with
     * {@link IllegalStateException}.
     */
    void close();

    OutT convert(InT message);
}
