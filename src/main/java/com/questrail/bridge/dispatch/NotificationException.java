package com.questrail.bridge.dispatch;

/**
 * A notification could not be delivered.
 */
public class NotificationException extends Exception
{
    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
