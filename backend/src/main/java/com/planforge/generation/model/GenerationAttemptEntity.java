package com.planforge.generation.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "generation_attempts")
public class GenerationAttemptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    @Column(name = "attempt_no", nullable = false)
    private Integer attemptNo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttemptStatus status;

    @Enumerated(EnumType.STRING)
    private FailureClassification classification;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "modules_count")
    private Integer modulesCount;

    @Column(name = "tasks_count")
    private Integer tasksCount;

    @Column(name = "prompt_hash", length = 64)
    private String promptHash;

    @Column(name = "truncated_topic", nullable = false)
    private boolean truncatedTopic;

    @Column(name = "truncated_notes", nullable = false)
    private boolean truncatedNotes;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "provider_name")
    private String providerName;

    @Column(name = "provider_model")
    private String providerModel;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getPlanId() {
        return planId;
    }

    public void setPlanId(UUID planId) {
        this.planId = planId;
    }

    public Integer getAttemptNo() {
        return attemptNo;
    }

    public void setAttemptNo(Integer attemptNo) {
        this.attemptNo = attemptNo;
    }

    public AttemptStatus getStatus() {
        return status;
    }

    public void setStatus(AttemptStatus status) {
        this.status = status;
    }

    public FailureClassification getClassification() {
        return classification;
    }

    public void setClassification(FailureClassification classification) {
        this.classification = classification;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public Integer getModulesCount() {
        return modulesCount;
    }

    public void setModulesCount(Integer modulesCount) {
        this.modulesCount = modulesCount;
    }

    public Integer getTasksCount() {
        return tasksCount;
    }

    public void setTasksCount(Integer tasksCount) {
        this.tasksCount = tasksCount;
    }

    public String getPromptHash() {
        return promptHash;
    }

    public void setPromptHash(String promptHash) {
        this.promptHash = promptHash;
    }

    public boolean isTruncatedTopic() {
        return truncatedTopic;
    }

    public void setTruncatedTopic(boolean truncatedTopic) {
        this.truncatedTopic = truncatedTopic;
    }

    public boolean isTruncatedNotes() {
        return truncatedNotes;
    }

    public void setTruncatedNotes(boolean truncatedNotes) {
        this.truncatedNotes = truncatedNotes;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getProviderName() {
        return providerName;
    }

    public void setProviderName(String providerName) {
        this.providerName = providerName;
    }

    public String getProviderModel() {
        return providerModel;
    }

    public void setProviderModel(String providerModel) {
        this.providerModel = providerModel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }
}
