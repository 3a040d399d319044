package com.planforge.plans.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.planforge.generation.service.GenerationInput;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.SkillLevel;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Caller-supplied changes applied to a persisted plan before regenerating it. A field missing from the
 * JSON keeps the stored value; an explicit {@code null} clears it, which only nullable fields allow.
 */
public record PlanOverrides(
        FieldPatch<String> topic,
        FieldPatch<String> notes,
        FieldPatch<SkillLevel> skillLevel,
        FieldPatch<Integer> weeklyHours,
        FieldPatch<LearningStyle> learningStyle,
        FieldPatch<LocalDate> startDate,
        FieldPatch<LocalDate> deadlineDate
) {

    static final int TOPIC_MIN_CHARS = 3;
    static final int TOPIC_MAX_CHARS = 500;
    static final int NOTES_MAX_CHARS = 4000;
    static final int MAX_WEEKLY_HOURS = 80;

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "topic", "notes", "skillLevel", "weeklyHours", "learningStyle", "startDate", "deadlineDate");

    public static PlanOverrides none() {
        return new PlanOverrides(FieldPatch.absent(), FieldPatch.absent(), FieldPatch.absent(), FieldPatch.absent(),
                FieldPatch.absent(), FieldPatch.absent(), FieldPatch.absent());
    }

    public static PlanOverrides from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return none();
        }
        if (!node.isObject()) {
            throw new InvalidPlanInputException("overrides must be an object");
        }
        for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) {
                throw new InvalidPlanInputException("Unknown override field: " + name);
            }
        }

        return new PlanOverrides(
                requiredField(node, "topic", PlanOverrides::text),
                nullableField(node, "notes", PlanOverrides::text),
                requiredField(node, "skillLevel", value -> enumValue(value, SkillLevel.class, "skillLevel")),
                requiredField(node, "weeklyHours", PlanOverrides::weeklyHours),
                requiredField(node, "learningStyle", value -> enumValue(value, LearningStyle.class, "learningStyle")),
                nullableField(node, "startDate", value -> date(value, "startDate")),
                nullableField(node, "deadlineDate", value -> date(value, "deadlineDate"))
        );
    }

    /**
     * Merges onto the plan's stored inputs and validates the result.
     */
    public GenerationInput applyTo(PlanEntity plan) {
        GenerationInput merged = new GenerationInput(
                topic.applyTo(plan.getTopic()),
                notes.applyTo(plan.getNotes()),
                skillLevel.applyTo(plan.getSkillLevel()),
                weeklyHours.applyTo(plan.getWeeklyHours()),
                learningStyle.applyTo(plan.getLearningStyle()),
                startDate.applyTo(plan.getStartDate()),
                deadlineDate.applyTo(plan.getDeadlineDate())
        );
        validate(merged);
        return merged;
    }

    static void validate(GenerationInput input) {
        String trimmedTopic = input.topic() == null ? "" : input.topic().trim();
        if (trimmedTopic.length() < TOPIC_MIN_CHARS || trimmedTopic.length() > TOPIC_MAX_CHARS) {
            throw new InvalidPlanInputException("topic must be between " + TOPIC_MIN_CHARS + " and " + TOPIC_MAX_CHARS + " characters");
        }
        if (input.notes() != null && input.notes().length() > NOTES_MAX_CHARS) {
            throw new InvalidPlanInputException("notes must be at most " + NOTES_MAX_CHARS + " characters");
        }
        if (input.startDate() != null && input.deadlineDate() != null && input.deadlineDate().isBefore(input.startDate())) {
            throw new InvalidPlanInputException("deadlineDate must not be before startDate");
        }
    }

    private static <T> FieldPatch<T> requiredField(JsonNode node, String name, Function<JsonNode, T> reader) {
        if (!node.has(name)) {
            return FieldPatch.absent();
        }
        JsonNode value = node.get(name);
        if (value.isNull()) {
            throw new InvalidPlanInputException(name + " cannot be cleared");
        }
        return FieldPatch.set(reader.apply(value));
    }

    private static <T> FieldPatch<T> nullableField(JsonNode node, String name, Function<JsonNode, T> reader) {
        if (!node.has(name)) {
            return FieldPatch.absent();
        }
        JsonNode value = node.get(name);
        return value.isNull() ? FieldPatch.clear() : FieldPatch.set(reader.apply(value));
    }

    private static String text(JsonNode value) {
        if (!value.isTextual()) {
            throw new InvalidPlanInputException("Expected a string override, got " + value.getNodeType());
        }
        return value.asText();
    }

    private static Integer weeklyHours(JsonNode value) {
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new InvalidPlanInputException("weeklyHours must be an integer");
        }
        int hours = value.intValue();
        if (hours < 1 || hours > MAX_WEEKLY_HOURS) {
            throw new InvalidPlanInputException("weeklyHours must be between 1 and " + MAX_WEEKLY_HOURS);
        }
        return hours;
    }

    private static <E extends Enum<E>> E enumValue(JsonNode value, Class<E> type, String name) {
        if (!value.isTextual()) {
            throw new InvalidPlanInputException(name + " must be a string");
        }
        try {
            return Enum.valueOf(type, value.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new InvalidPlanInputException("Unsupported " + name + ": " + value.asText(), exception);
        }
    }

    private static LocalDate date(JsonNode value, String name) {
        if (!value.isTextual()) {
            throw new InvalidPlanInputException(name + " must be an ISO date");
        }
        try {
            return LocalDate.parse(value.asText());
        } catch (DateTimeParseException exception) {
            throw new InvalidPlanInputException(name + " must be an ISO date", exception);
        }
    }
}
