package com.p14n.fanout.consumer;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.connection.MessageHandler;
import com.p14n.fanout.connection.RealtimeMessaging;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.WireMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects {@code notification} messages received on a connection and tracks
 * which of them have been read.
 */
public class NotificationService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final List<WireMessage> notifications = new CopyOnWriteArrayList<>();
    private final Set<String> read = ConcurrentHashMap.newKeySet();
    private final Set<MessageHandler> listeners = new CopyOnWriteArraySet<>();
    private final Subscription subscription;

    public NotificationService(RealtimeMessaging messaging) {
        this.subscription = messaging.subscribeToType(MessageType.NOTIFICATION, this::onNotificationMessage);
    }

    private void onNotificationMessage(WireMessage message) {
        notifications.add(message);
        logger.atDebug().addArgument(message.id()).log("Received notification {}");
        for (MessageHandler listener : listeners) {
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(message.id())
                        .setCause(e)
                        .log("Notification listener failed on {}");
            }
        }
    }

    /**
     * Registers a listener called for each new notification.
     */
    public Subscription onNotification(MessageHandler listener) {
        listeners.add(listener);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                listeners.remove(listener);
            }

            @Override
            public boolean isActive() {
                return listeners.contains(listener);
            }
        };
    }

    public List<WireMessage> getNotifications() {
        return List.copyOf(notifications);
    }

    public List<WireMessage> getUnread() {
        return notifications.stream().filter(n -> !read.contains(n.id())).toList();
    }

    /**
     * Marks a notification read.
     *
     * @return false if no notification has that id
     */
    public boolean markAsRead(String notificationId) {
        boolean known = notifications.stream().anyMatch(n -> n.id().equals(notificationId));
        if (known) {
            read.add(notificationId);
        }
        return known;
    }

    public boolean isRead(String notificationId) {
        return read.contains(notificationId);
    }

    public void clearNotifications() {
        notifications.clear();
        read.clear();
    }

    @Override
    public void close() {
        subscription.unsubscribe();
        listeners.clear();
    }
}
