package com.di.loannova.orchestrator;

import lombok.extern.slf4j.Slf4j;

/** Default sink: alerts go to the application log. */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void notify(String message, String channel) {
        log.warn("[ALERT:{}] {}", channel, message);
    }
}
