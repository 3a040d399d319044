package com.planforge.streaming;

import java.util.Map;

public record StreamingEvent(
        StreamingEventType type,
        Map<String, Object> data
) {
}
