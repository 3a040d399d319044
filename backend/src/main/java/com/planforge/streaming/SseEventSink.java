package com.planforge.streaming;

import com.planforge.common.cancel.CancellationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes events to an {@link SseEmitter}. A failed write means the client is gone: the request
 * token is cancelled and later events are dropped.
 */
public class SseEventSink implements StreamEventSink {

    private static final Logger log = LoggerFactory.getLogger(SseEventSink.class);

    private final SseEmitter emitter;
    private final CancellationSource requestSource;
    private volatile boolean closed;

    public SseEventSink(SseEmitter emitter, CancellationSource requestSource) {
        this.emitter = emitter;
        this.requestSource = requestSource;
    }

    @Override
    public void send(StreamingEvent event) {
        if (closed) {
            return;
        }
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event.data(), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException exception) {
            closed = true;
            requestSource.cancel();
            log.debug("Client disconnected before {} event", event.type().wireName(), exception);
            return;
        }
        if (event.type().isTerminal()) {
            complete();
        }
    }

    public void complete() {
        if (closed) {
            return;
        }
        closed = true;
        emitter.complete();
    }
}
