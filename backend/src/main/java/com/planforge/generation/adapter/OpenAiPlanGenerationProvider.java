package com.planforge.generation.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.cancel.CancellationToken;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.PlanGenerationProvider;
import com.planforge.generation.service.ProviderException;
import com.planforge.generation.service.ProviderMetadata;
import com.planforge.generation.service.ProviderResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
@ConditionalOnProperty(value = "app.ai.provider", havingValue = "openai")
public class OpenAiPlanGenerationProvider implements PlanGenerationProvider {

    static final String PROVIDER = "openai";

    private static final String SYSTEM_PROMPT = """
            You design structured self-study learning plans.
            Respond with a single JSON object and nothing else, shaped as:
            {"modules":[{"title":string,"description":string,"estimatedMinutes":number,
              "tasks":[{"title":string,"description":string,"estimatedMinutes":number}]}]}
            Rules:
            - Between 1 and 12 modules, ordered from first to last.
            - Every module has between 1 and 20 concrete tasks.
            - estimatedMinutes are realistic positive integers.
            - Fit the total effort to the weekly hours and dates you are given.
            """;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public OpenAiPlanGenerationProvider(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(appProperties.ai().openai().connectTimeout());
        requestFactory.setReadTimeout(appProperties.ai().openai().readTimeout());
        this.restClient = builder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public ProviderResponse generate(GenerationInput input, CancellationToken cancellationToken) {
        AppProperties.OpenAi openai = appProperties.ai().openai();
        if (openai.apiKey() == null || openai.apiKey().isBlank()) {
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "OpenAI API key is not configured");
        }

        Map<String, Object> payload = Map.of(
                "model", openai.model(),
                "temperature", 0.4,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", buildUserPrompt(input))
                )
        );

        cancellationToken.throwIfCancelled();
        String rawResponse;
        try {
            rawResponse = restClient.post()
                    .uri(openai.baseUrl() + "/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + openai.apiKey())
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException exception) {
            throw new ProviderException(classifyStatus(exception.getStatusCode().value()),
                    "OpenAI responded with HTTP " + exception.getStatusCode().value(), exception);
        } catch (ResourceAccessException exception) {
            FailureClassification classification = isTimeout(exception)
                    ? FailureClassification.TIMEOUT
                    : FailureClassification.PROVIDER_ERROR;
            throw new ProviderException(classification, "OpenAI request failed: " + exception.getMessage(), exception);
        }

        return toResponse(rawResponse, openai.model());
    }

    static FailureClassification classifyStatus(int status) {
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return FailureClassification.RATE_LIMIT;
        }
        if (status == HttpStatus.REQUEST_TIMEOUT.value() || status == HttpStatus.GATEWAY_TIMEOUT.value()) {
            return FailureClassification.TIMEOUT;
        }
        return FailureClassification.PROVIDER_ERROR;
    }

    private boolean isTimeout(Throwable exception) {
        for (Throwable cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private ProviderResponse toResponse(String rawResponse, String requestedModel) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "OpenAI returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawResponse);
        } catch (JsonProcessingException exception) {
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "OpenAI returned malformed JSON", exception);
        }

        JsonNode usage = root.path("usage");
        ProviderMetadata metadata = new ProviderMetadata(
                PROVIDER,
                root.path("model").asText(requestedModel),
                usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0),
                usage.path("total_tokens").asLong(0)
        );

        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "OpenAI returned no message content", null, metadata);
        }
        return new ProviderResponse(content.asText(), metadata);
    }

    private String buildUserPrompt(GenerationInput input) {
        return """
                Topic: %s
                Skill level: %s
                Weekly hours available: %d
                Preferred learning style: %s
                Start date: %s
                Deadline: %s
                Notes from the learner:
                %s
                """.formatted(
                input.topic(),
                input.skillLevel().name().toLowerCase(Locale.ROOT),
                input.weeklyHours(),
                input.learningStyle().name().toLowerCase(Locale.ROOT),
                input.startDate() == null ? "not set" : input.startDate(),
                input.deadlineDate() == null ? "not set" : input.deadlineDate(),
                input.notes() == null || input.notes().isBlank() ? "none" : input.notes()
        );
    }
}
