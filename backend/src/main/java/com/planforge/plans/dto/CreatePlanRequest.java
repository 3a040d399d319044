package com.planforge.plans.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.SkillLevel;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreatePlanRequest(
        @NotBlank @Size(min = 3, max = 500) String topic,
        @Size(max = 4000) String notes,
        @NotNull SkillLevel skillLevel,
        @NotNull @Min(1) @Max(80) Integer weeklyHours,
        @NotNull LearningStyle learningStyle,
        LocalDate startDate,
        LocalDate deadlineDate
) {

    @JsonIgnore
    @AssertTrue(message = "requires deadlineDate on or after startDate")
    public boolean isDateRangeValid() {
        return startDate == null || deadlineDate == null || !deadlineDate.isBefore(startDate);
    }
}
