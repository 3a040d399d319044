package com.planforge.streaming;

import com.planforge.common.cancel.CancellationToken;
import com.planforge.common.cancel.CompositeCancellationToken;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.GenerationResult;
import com.planforge.generation.service.ParsedModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Drives a live generation and translates it into events. Every run sends {@code plan_start} first and
 * exactly one terminal event last; on the failure path persisted state is finalized before that
 * terminal event goes out.
 */
@Component
public class StreamingEventPipeline {

    private static final Logger log = LoggerFactory.getLogger(StreamingEventPipeline.class);

    private final ErrorSanitizer errorSanitizer;

    public StreamingEventPipeline(ErrorSanitizer errorSanitizer) {
        this.errorSanitizer = errorSanitizer;
    }

    public void run(StreamEventSink sink, StreamRun run) {
        long startedAt = System.nanoTime();
        UUID planId = run.planId();
        sink.send(new StreamingEvent(StreamingEventType.PLAN_START, run.planStart()));

        CancellationToken token = CompositeCancellationToken.anyOf(run.requestToken(), run.streamToken());

        GenerationResult result;
        try {
            result = run.generation().apply(token);
        } catch (RuntimeException exception) {
            log.error("Generation for plan {} threw", planId, exception);
            cleanup(planId, () -> run.onUnhandledError().accept(exception));
            sink.send(failureEvent(planId, token, exception.toString(), FailureClassification.UNKNOWN));
            return;
        }

        if (result instanceof GenerationResult.Failure failure) {
            cleanup(planId, () -> run.onFailure().accept(failure));
            sink.send(failureEvent(planId, token, failure.error(), failure.classification()));
            return;
        }

        GenerationResult.Success success = (GenerationResult.Success) result;
        emitModules(sink, planId, success.modules());
        try {
            run.onSuccess().accept(success);
        } catch (RuntimeException exception) {
            log.error("Persisting generated plan {} failed", planId, exception);
            cleanup(planId, () -> run.onUnhandledError().accept(exception));
            sink.send(errorEvent(planId, exception.toString(), FailureClassification.UNKNOWN));
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planId", planId);
        data.put("modulesCount", success.modules().size());
        data.put("tasksCount", success.tasksCount());
        data.put("durationMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        sink.send(new StreamingEvent(StreamingEventType.COMPLETE, data));
    }

    private void emitModules(StreamEventSink sink, UUID planId, List<ParsedModule> modules) {
        int total = modules.size();
        for (int index = 0; index < total; index++) {
            ParsedModule module = modules.get(index);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("planId", planId);
            summary.put("index", index);
            summary.put("title", module.title());
            summary.put("description", module.description());
            summary.put("estimatedMinutes", module.estimatedMinutes());
            summary.put("tasksCount", module.tasks().size());
            sink.send(new StreamingEvent(StreamingEventType.MODULE_SUMMARY, summary));

            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("planId", planId);
            progress.put("modulesParsed", index + 1);
            progress.put("modulesTotalHint", total);
            sink.send(new StreamingEvent(StreamingEventType.PROGRESS, progress));
        }
    }

    // cancellation is not a content failure, so it is never classified
    private StreamingEvent failureEvent(UUID planId,
                                        CancellationToken token,
                                        String rawError,
                                        FailureClassification classification) {
        if (token.isCancelled()) {
            log.info("Stream for plan {} cancelled: {}", planId, rawError);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("planId", planId);
            return new StreamingEvent(StreamingEventType.CANCELLED, data);
        }
        return errorEvent(planId, rawError, classification);
    }

    private StreamingEvent errorEvent(UUID planId, String rawError, FailureClassification classification) {
        SanitizedError sanitized = errorSanitizer.sanitize(planId, rawError, classification);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planId", planId);
        data.put("code", sanitized.code());
        data.put("message", sanitized.message());
        data.put("classification", sanitized.classification().wireName());
        data.put("retryable", sanitized.retryable());
        return new StreamingEvent(StreamingEventType.ERROR, data);
    }

    private static void cleanup(UUID planId, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException exception) {
            log.error("Cleanup for plan {} failed; sending terminal event anyway", planId, exception);
        }
    }
}
