package com.planforge.streaming;

import com.planforge.common.cancel.CancellationToken;
import com.planforge.generation.service.GenerationResult;

import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One live generation.
 *
 * @param requestToken     cancelled when the client goes away
 * @param streamToken      cancelled when the server side stream deadline passes
 * @param generation       runs the attempt under the merged token
 * @param onSuccess        persists a successful result before {@code complete} is sent
 * @param onFailure        finalizes a failed result before the terminal event
 * @param onUnhandledError finalizes state when generation or persistence throws
 */
public record StreamRun(
        UUID planId,
        Map<String, Object> planStart,
        CancellationToken requestToken,
        CancellationToken streamToken,
        Function<CancellationToken, GenerationResult> generation,
        Consumer<GenerationResult.Success> onSuccess,
        Consumer<GenerationResult.Failure> onFailure,
        Consumer<Throwable> onUnhandledError
) {
}
