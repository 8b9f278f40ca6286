package com.questrail.bridge.dispatch;

/**
 * Delivers operator notifications.
 *
 * <p>Called from the dispatcher's notification thread, one notification at a
 * time. Implementations may block; the dispatcher bounds each call and
 * interrupts it on expiry.</p>
 */
public interface Notifier
{
    void send(Notification notification) throws NotificationException;
}
