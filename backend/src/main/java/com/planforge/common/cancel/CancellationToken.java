package com.planforge.common.cancel;

import java.util.concurrent.CancellationException;

/**
 * Read side of a cooperative cancellation signal. Downstream code only ever observes a single
 * boolean; sources are combined with {@link CompositeCancellationToken}.
 */
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
