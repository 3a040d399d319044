package com.planforge.plans.service;

import java.util.Locale;

/**
 * One field of a partial update: left alone, cleared, or set to a value.
 */
public final class FieldPatch<T> {

    private enum Kind { ABSENT, CLEAR, SET }

    private static final FieldPatch<?> ABSENT = new FieldPatch<>(Kind.ABSENT, null);
    private static final FieldPatch<?> CLEAR = new FieldPatch<>(Kind.CLEAR, null);

    private final Kind kind;
    private final T value;

    private FieldPatch(Kind kind, T value) {
        this.kind = kind;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> absent() {
        return (FieldPatch<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> clear() {
        return (FieldPatch<T>) CLEAR;
    }

    public static <T> FieldPatch<T> set(T value) {
        return new FieldPatch<>(Kind.SET, value);
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isClear() {
        return kind == Kind.CLEAR;
    }

    public T applyTo(T current) {
        return switch (kind) {
            case ABSENT -> current;
            case CLEAR -> null;
            case SET -> value;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.SET ? "set(" + value + ")" : kind.name().toLowerCase(Locale.ROOT);
    }
}
