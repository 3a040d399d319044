package com.planforge.generation.service;

import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.SkillLevel;

import java.time.LocalDate;

public record GenerationInput(
        String topic,
        String notes,
        SkillLevel skillLevel,
        int weeklyHours,
        LearningStyle learningStyle,
        LocalDate startDate,
        LocalDate deadlineDate
) {

    public static GenerationInput fromPlan(PlanEntity plan) {
        return new GenerationInput(
                plan.getTopic(),
                plan.getNotes(),
                plan.getSkillLevel(),
                plan.getWeeklyHours(),
                plan.getLearningStyle(),
                plan.getStartDate(),
                plan.getDeadlineDate()
        );
    }

    /**
     * Stable text form used for prompt hashing.
     */
    public String canonicalForm() {
        return String.join("|",
                topic.trim(),
                notes == null ? "" : notes.trim(),
                skillLevel.name(),
                String.valueOf(weeklyHours),
                learningStyle.name(),
                startDate == null ? "" : startDate.toString(),
                deadlineDate == null ? "" : deadlineDate.toString());
    }
}
