package com.di.loannova.orchestrator;

/**
 * Outbound alert channel. Delivery is fire-and-forget; a failing sink never fails the run.
 */
public interface NotificationSink {

    void notify(String message, String channel);
}
