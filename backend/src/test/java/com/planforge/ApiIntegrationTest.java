package com.planforge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.security.UserRole;
import com.planforge.generation.repo.GenerationAttemptRepository;
import com.planforge.jobs.repo.JobRepository;
import com.planforge.plans.repo.PlanModuleRepository;
import com.planforge.plans.repo.PlanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApiIntegrationTest {

    private static final String PLAN_BODY = """
            {"topic":"Distributed systems","skillLevel":"intermediate","weeklyHours":8,
             "learningStyle":"mixed","startDate":"2026-01-05","deadlineDate":"2026-03-30"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private GenerationAttemptRepository attemptRepository;

    @Autowired
    private PlanModuleRepository planModuleRepository;

    @Autowired
    private PlanRepository planRepository;

    private final UUID learnerId = UUID.randomUUID();

    @BeforeEach
    void cleanState() {
        jobRepository.deleteAll();
        attemptRepository.deleteAll();
        planModuleRepository.deleteAll();
        planRepository.deleteAll();
    }

    @Test
    void createPlanQueuesGenerationJob() throws Exception {
        JsonNode accepted = createPlan(learnerId);
        String planId = accepted.get("planId").asText();

        assertThat(accepted.get("status").asText()).isEqualTo("pending");
        assertThat(accepted.get("jobId").asText()).isNotBlank();

        mockMvc.perform(get("/v1/plans/{planId}/status", planId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generationStatus").value("PENDING"))
                .andExpect(jsonPath("$.latestJob.type").value("PLAN_GENERATION"))
                .andExpect(jsonPath("$.latestJob.status").value("PENDING"))
                .andExpect(jsonPath("$.attempts").isEmpty());
    }

    @Test
    void invalidPlanRequestIsRejected() throws Exception {
        mockMvc.perform(post("/v1/plans")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"Go","skillLevel":"beginner","weeklyHours":0,"learningStyle":"video"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(post("/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void streamingCreateEmitsLifecycleAndPersistsPlan() throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/plans/stream")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(PLAN_BODY))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:plan_start", "event:module_summary", "event:progress", "event:complete");
        assertThat(body).doesNotContain("event:error");
        assertThat(body.indexOf("event:plan_start")).isLessThan(body.indexOf("event:complete"));

        UUID planId = planRepository.findAll().get(0).getId();
        mockMvc.perform(get("/v1/plans/{planId}/status", planId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generationStatus").value("READY"))
                .andExpect(jsonPath("$.modulesCount").value(4))
                .andExpect(jsonPath("$.attempts[0].attemptNo").value(1))
                .andExpect(jsonPath("$.attempts[0].status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.attempts[0].tasksCount").value(12));

        mockMvc.perform(post("/v1/plans/{planId}/retry", planId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void retryOfAnotherUsersPlanIsNotFound() throws Exception {
        String planId = createPlan(learnerId).get("planId").asText();

        mockMvc.perform(post("/v1/plans/{planId}/retry", planId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(UUID.randomUUID(), UserRole.LEARNER)))
                .andExpect(status().isNotFound());
    }

    @Test
    void regenerationIsDedupedAndQuotaLimited() throws Exception {
        String first = createPlan(learnerId).get("planId").asText();
        String second = createPlan(learnerId).get("planId").asText();
        String third = createPlan(learnerId).get("planId").asText();

        String firstJob = regenerate(first, "{\"overrides\":{\"weeklyHours\":4}}").get("jobId").asText();
        String repeatJob = regenerate(first, null).get("jobId").asText();
        assertThat(repeatJob).isEqualTo(firstJob);

        regenerate(second, "{\"overrides\":{\"notes\":null}}");

        mockMvc.perform(post("/v1/plans/{planId}/regenerate", third)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER)))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void regenerationRejectsUnknownOverride() throws Exception {
        String planId = createPlan(learnerId).get("planId").asText();

        mockMvc.perform(post("/v1/plans/{planId}/regenerate", planId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"overrides\":{\"favouriteColour\":\"blue\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown override field: favouriteColour"));
    }

    @Test
    void workerEndpointsRequireOperatorRole() throws Exception {
        mockMvc.perform(get("/v1/worker/health")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/v1/worker/health")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(UUID.randomUUID(), UserRole.OPERATOR)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));

        mockMvc.perform(get("/v1/worker/jobs/stats")
                        .param("hours", "0")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(UUID.randomUUID(), UserRole.OPERATOR)))
                .andExpect(status().isBadRequest());
    }

    private JsonNode createPlan(UUID userId) throws Exception {
        String response = mockMvc.perform(post("/v1/plans")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(userId, UserRole.LEARNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(response);
    }

    private JsonNode regenerate(String planId, String body) throws Exception {
        MockHttpServletRequestBuilder request = post("/v1/plans/{planId}/regenerate", planId)
                .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(learnerId, UserRole.LEARNER));
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(body);
        }
        String response = mockMvc.perform(request)
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(response);
    }
}
