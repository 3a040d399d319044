package com.planforge.streaming;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StreamingEventType {
    PLAN_START,
    MODULE_SUMMARY,
    PROGRESS,
    COMPLETE,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
