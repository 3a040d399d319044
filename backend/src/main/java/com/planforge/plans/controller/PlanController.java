package com.planforge.plans.controller;

import com.planforge.common.security.SecurityUtils;
import com.planforge.jobs.dto.JobResponse;
import com.planforge.plans.dto.CreatePlanRequest;
import com.planforge.plans.dto.PlanAcceptedResponse;
import com.planforge.plans.dto.PlanStatusResponse;
import com.planforge.plans.dto.RegeneratePlanRequest;
import com.planforge.plans.service.PlanWorkflowService;
import com.planforge.streaming.PlanStreamService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/plans")
public class PlanController {

    private final PlanWorkflowService workflowService;
    private final PlanStreamService streamService;

    public PlanController(PlanWorkflowService workflowService, PlanStreamService streamService) {
        this.workflowService = workflowService;
        this.streamService = streamService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PlanAcceptedResponse createPlan(@RequestBody @Valid CreatePlanRequest request) {
        return workflowService.submitPlan(SecurityUtils.currentUserId(), request);
    }

    @PostMapping("/stream")
    public SseEmitter createAndStream(@RequestBody @Valid CreatePlanRequest request) {
        return streamService.createAndStream(SecurityUtils.currentUserId(), request);
    }

    @PostMapping("/{planId}/retry")
    public SseEmitter retry(@PathVariable UUID planId) {
        return streamService.retry(SecurityUtils.currentUserId(), planId);
    }

    @PostMapping("/{planId}/regenerate")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PlanAcceptedResponse regenerate(@PathVariable UUID planId,
                                           @RequestBody(required = false) RegeneratePlanRequest request) {
        return workflowService.requestRegeneration(SecurityUtils.currentUserId(), planId, request == null ? null : request.overrides());
    }

    @GetMapping("/{planId}/status")
    public PlanStatusResponse status(@PathVariable UUID planId) {
        return workflowService.status(SecurityUtils.currentUserId(), planId);
    }

    @GetMapping("/{planId}/jobs")
    public List<JobResponse> jobs(@PathVariable UUID planId) {
        return workflowService.jobs(SecurityUtils.currentUserId(), planId);
    }
}
