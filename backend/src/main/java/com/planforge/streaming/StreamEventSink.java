package com.planforge.streaming;

/**
 * Destination for stream events. Implementations must not throw: a dead client is reported by
 * cancelling the request token instead.
 */
public interface StreamEventSink {

    void send(StreamingEvent event);
}
