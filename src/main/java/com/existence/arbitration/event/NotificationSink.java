package com.existence.arbitration.event;

/**
 * External transport for binding notifications (socket broadcast, queue, webhook...).
 */
public interface NotificationSink {

    /**
     * Delivers one signal.
     *
     * @param signal      signal name, e.g. {@code binding:hidden}
     * @param payloadJson JSON payload
     * @throws Exception if the transport failed; the dispatcher may retry
     */
    void deliver(String signal, String payloadJson) throws Exception;
}
