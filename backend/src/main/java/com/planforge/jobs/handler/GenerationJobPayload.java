package com.planforge.jobs.handler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.planforge.generation.service.GenerationInput;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.SkillLevel;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationJobPayload(
        @NotBlank @Size(min = 3, max = 500) String topic,
        @Size(max = 4000) String notes,
        @NotNull SkillLevel skillLevel,
        @NotNull @Min(1) @Max(80) Integer weeklyHours,
        @NotNull LearningStyle learningStyle,
        LocalDate startDate,
        LocalDate deadlineDate
) {

    public static GenerationJobPayload from(GenerationInput input) {
        return new GenerationJobPayload(
                input.topic(),
                input.notes(),
                input.skillLevel(),
                input.weeklyHours(),
                input.learningStyle(),
                input.startDate(),
                input.deadlineDate()
        );
    }

    @JsonIgnore
    @AssertTrue(message = "requires deadlineDate on or after startDate")
    public boolean isDateRangeValid() {
        return startDate == null || deadlineDate == null || !deadlineDate.isBefore(startDate);
    }

    public GenerationInput toInput() {
        return new GenerationInput(topic, notes, skillLevel, weeklyHours, learningStyle, startDate, deadlineDate);
    }
}
