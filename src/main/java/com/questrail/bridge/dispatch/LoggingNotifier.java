package com.questrail.bridge.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log. Used when no hook command is configured.
 */
public final class LoggingNotifier implements Notifier
{
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(Notification notification)
    {
        log.warn("NOTIFY [{}] {}", notification.ruleId(), notification.message());
    }
}
