package com.planforge.common.cancel;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cancelled as soon as any of its sources is cancelled.
 */
public final class CompositeCancellationToken implements CancellationToken {

    private final List<CancellationToken> sources;

    private CompositeCancellationToken(List<CancellationToken> sources) {
        this.sources = sources;
    }

    public static CancellationToken anyOf(CancellationToken... sources) {
        List<CancellationToken> present = Arrays.stream(sources)
                .filter(Objects::nonNull)
                .toList();
        if (present.isEmpty()) {
            return CancellationToken.NONE;
        }
        if (present.size() == 1) {
            return present.get(0);
        }
        return new CompositeCancellationToken(present);
    }

    @Override
    public boolean isCancelled() {
        for (CancellationToken source : sources) {
            if (source.isCancelled()) {
                return true;
            }
        }
        return false;
    }
}
