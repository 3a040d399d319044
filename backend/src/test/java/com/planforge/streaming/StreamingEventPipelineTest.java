package com.planforge.streaming;

import com.planforge.common.cancel.CancellationSource;
import com.planforge.common.cancel.CancellationToken;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.GenerationResult;
import com.planforge.generation.service.ParsedModule;
import com.planforge.generation.service.ParsedTask;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingEventPipelineTest {

    private final StreamingEventPipeline pipeline = new StreamingEventPipeline(new ErrorSanitizer());
    private final UUID planId = UUID.randomUUID();
    private final List<String> timeline = new ArrayList<>();
    private final List<StreamingEvent> events = new ArrayList<>();
    private final StreamEventSink sink = event -> {
        events.add(event);
        timeline.add(event.type().wireName());
    };

    @Test
    void successStreamsModulesThenComplete() {
        GenerationResult.Success success = success(2, 3);

        pipeline.run(sink, run(token -> success, CancellationToken.NONE));

        assertThat(events).extracting(StreamingEvent::type).containsExactly(
                StreamingEventType.PLAN_START,
                StreamingEventType.MODULE_SUMMARY, StreamingEventType.PROGRESS,
                StreamingEventType.MODULE_SUMMARY, StreamingEventType.PROGRESS,
                StreamingEventType.COMPLETE);
        assertThat(events.get(3).data()).containsEntry("index", 1).containsEntry("tasksCount", 3);
        assertThat(events.get(4).data()).containsEntry("modulesParsed", 2).containsEntry("modulesTotalHint", 2);
        Map<String, Object> complete = events.get(5).data();
        assertThat(complete).containsEntry("planId", planId).containsEntry("modulesCount", 2).containsEntry("tasksCount", 6);
        assertThat(timeline.indexOf("persisted")).isLessThan(timeline.indexOf("complete"));
    }

    @Test
    void failureIsFinalizedBeforeSanitizedError() {
        GenerationResult.Failure failure = new GenerationResult.Failure(
                "upstream said: invalid api key sk-123", FailureClassification.PROVIDER_ERROR, 10, null);

        pipeline.run(sink, run(token -> failure, CancellationToken.NONE));

        assertThat(timeline).containsExactly("plan_start", "failed", "error");
        Map<String, Object> error = events.get(1).data();
        assertThat(error).containsEntry("code", "PROVIDER_ERROR")
                .containsEntry("classification", "provider_error")
                .containsEntry("retryable", true);
        assertThat(error.get("message").toString()).doesNotContain("sk-123");
    }

    @Test
    void cancelledRunEndsWithCancelledEvent() {
        CancellationSource request = new CancellationSource();
        Function<CancellationToken, GenerationResult> generation = token -> {
            request.cancel();
            return new GenerationResult.Failure("Generation cancelled", FailureClassification.TIMEOUT, 5, null);
        };

        pipeline.run(sink, run(generation, request));

        assertThat(timeline).containsExactly("plan_start", "failed", "cancelled");
    }

    @Test
    void streamDeadlineCancelsBlockedGeneration() throws Exception {
        CancellationSource deadline = new CancellationSource();
        Function<CancellationToken, GenerationResult> generation = token -> {
            while (!token.isCancelled()) {
                Thread.onSpinWait();
            }
            return new GenerationResult.Failure("Generation cancelled", FailureClassification.TIMEOUT, 200, null);
        };
        StreamRun run = new StreamRun(planId, Map.of("planId", planId), CancellationToken.NONE, deadline, generation,
                success -> timeline.add("persisted"),
                failure -> timeline.add("failed"),
                error -> timeline.add("unhandled"));
        Thread timer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
            }
            deadline.cancel();
        });

        timer.start();
        pipeline.run(sink, run);
        timer.join(2000);

        assertThat(timeline).containsExactly("plan_start", "failed", "cancelled");
        assertThat(events.get(1).data()).containsOnlyKeys("planId");
    }

    @Test
    void thrownGenerationStillEndsWithOneTerminalEvent() {
        pipeline.run(sink, run(token -> {
            throw new IllegalStateException("bug");
        }, CancellationToken.NONE));

        assertThat(timeline).containsExactly("plan_start", "unhandled", "error");
        assertThat(events.get(1).data()).containsEntry("code", "GENERATION_FAILED");
    }

    @Test
    void persistenceFailureReplacesCompleteWithError() {
        GenerationResult.Success success = success(1, 1);
        StreamRun run = new StreamRun(planId, Map.of("planId", planId), CancellationToken.NONE, CancellationToken.NONE,
                token -> success,
                result -> {
                    throw new IllegalStateException("constraint violation");
                },
                failed -> timeline.add("failed"),
                error -> timeline.add("unhandled"));

        pipeline.run(sink, run);

        assertThat(timeline).containsExactly("plan_start", "module_summary", "progress", "unhandled", "error");
        assertThat(events).filteredOn(event -> event.type().isTerminal()).hasSize(1);
    }

    @Test
    void failingCleanupDoesNotSuppressTerminalEvent() {
        GenerationResult.Failure failure = new GenerationResult.Failure("bad", FailureClassification.VALIDATION, 1, null);
        Consumer<GenerationResult.Failure> brokenCleanup = f -> {
            throw new IllegalStateException("db down");
        };
        StreamRun run = new StreamRun(planId, Map.of("planId", planId), CancellationToken.NONE, CancellationToken.NONE,
                token -> failure, success -> { }, brokenCleanup, error -> { });

        pipeline.run(sink, run);

        assertThat(events).extracting(StreamingEvent::type)
                .containsExactly(StreamingEventType.PLAN_START, StreamingEventType.ERROR);
        assertThat(events.get(1).data()).containsEntry("code", "INVALID_OUTPUT").containsEntry("retryable", false);
    }

    private StreamRun run(Function<CancellationToken, GenerationResult> generation, CancellationToken requestToken) {
        return new StreamRun(planId, Map.of("planId", planId), requestToken, CancellationToken.NONE, generation,
                success -> timeline.add("persisted"),
                failure -> timeline.add("failed"),
                error -> timeline.add("unhandled"));
    }

    private GenerationResult.Success success(int modules, int tasksPerModule) {
        List<ParsedModule> parsed = new ArrayList<>();
        for (int i = 0; i < modules; i++) {
            List<ParsedTask> tasks = new ArrayList<>();
            for (int j = 0; j < tasksPerModule; j++) {
                tasks.add(new ParsedTask("Task " + j, null, 30));
            }
            parsed.add(new ParsedModule("Module " + i, "About " + i, 90, tasks));
        }
        return new GenerationResult.Success(parsed, 100, UUID.randomUUID(), null);
    }
}
