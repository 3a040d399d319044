package com.planforge.common.cancel;

import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationSource implements CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return true if this call flipped the source, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
