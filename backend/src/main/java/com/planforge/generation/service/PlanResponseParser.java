package com.planforge.generation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the provider's raw JSON document into validated modules. Any structural problem is a
 * {@link PlanParseException}; minute estimates are clamped rather than rejected.
 */
@Component
public class PlanResponseParser {

    public static final int MAX_RAW_RESPONSE_CHARS = 200_000;
    public static final int MAX_MODULE_COUNT = 12;
    public static final int MAX_TASKS_PER_MODULE = 20;

    static final int MIN_TASK_MINUTES = 5;
    static final int MAX_TASK_MINUTES = 480;
    static final int MIN_MODULE_MINUTES = 15;
    static final int MAX_MODULE_MINUTES = 10_080;

    private final ObjectMapper objectMapper;

    public PlanResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ParsedModule> parse(String rawContent) {
        if (rawContent == null || rawContent.isBlank()) {
            throw new PlanParseException("Provider returned empty content");
        }
        if (rawContent.length() > MAX_RAW_RESPONSE_CHARS) {
            throw new PlanParseException("Provider response exceeds " + MAX_RAW_RESPONSE_CHARS + " characters");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(rawContent.trim()));
        } catch (JsonProcessingException exception) {
            throw new PlanParseException("Provider response is not valid JSON", exception);
        }

        JsonNode modulesNode = root.isArray() ? root : root.path("modules");
        if (!modulesNode.isArray()) {
            throw new PlanParseException("Provider response has no modules array");
        }
        if (modulesNode.isEmpty()) {
            throw new PlanParseException("Plan must contain at least one module");
        }
        if (modulesNode.size() > MAX_MODULE_COUNT) {
            throw new PlanParseException("Plan has " + modulesNode.size() + " modules; at most " + MAX_MODULE_COUNT + " allowed");
        }

        List<ParsedModule> modules = new ArrayList<>(modulesNode.size());
        for (int i = 0; i < modulesNode.size(); i++) {
            modules.add(parseModule(modulesNode.get(i), i));
        }
        return List.copyOf(modules);
    }

    private ParsedModule parseModule(JsonNode node, int index) {
        String label = "Module " + (index + 1);
        if (!node.isObject()) {
            throw new PlanParseException(label + " is not an object");
        }

        String title = requireText(node, label, "title");
        JsonNode tasksNode = node.path("tasks");
        if (!tasksNode.isArray() || tasksNode.isEmpty()) {
            throw new PlanParseException(label + " must contain at least one task");
        }
        if (tasksNode.size() > MAX_TASKS_PER_MODULE) {
            throw new PlanParseException(label + " has " + tasksNode.size() + " tasks; at most " + MAX_TASKS_PER_MODULE + " allowed");
        }

        List<ParsedTask> tasks = new ArrayList<>(tasksNode.size());
        for (int i = 0; i < tasksNode.size(); i++) {
            tasks.add(parseTask(tasksNode.get(i), label + " task " + (i + 1)));
        }

        Double declaredMinutes = readMinutes(node, label);
        int minutes = declaredMinutes == null
                ? tasks.stream().mapToInt(ParsedTask::estimatedMinutes).sum()
                : clamp(declaredMinutes, MIN_MODULE_MINUTES, MAX_MODULE_MINUTES);

        return new ParsedModule(title, optionalText(node, "description", "summary"), minutes, List.copyOf(tasks));
    }

    private ParsedTask parseTask(JsonNode node, String label) {
        if (!node.isObject()) {
            throw new PlanParseException(label + " is not an object");
        }
        String title = requireText(node, label, "title", "task");
        Double minutes = readMinutes(node, label);
        if (minutes == null) {
            throw new PlanParseException(label + " is missing estimatedMinutes");
        }
        return new ParsedTask(title, optionalText(node, "description", "summary"), clamp(minutes, MIN_TASK_MINUTES, MAX_TASK_MINUTES));
    }

    private Double readMinutes(JsonNode node, String label) {
        JsonNode value = node.has("estimatedMinutes") ? node.get("estimatedMinutes") : node.get("estimated_minutes");
        if (value == null || value.isNull()) {
            return null;
        }
        double minutes;
        if (value.isNumber()) {
            minutes = value.asDouble();
        } else if (value.isTextual()) {
            try {
                minutes = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException exception) {
                throw new PlanParseException(label + " has a non-numeric estimatedMinutes", exception);
            }
        } else {
            throw new PlanParseException(label + " has a non-numeric estimatedMinutes");
        }
        if (!Double.isFinite(minutes) || minutes <= 0) {
            throw new PlanParseException(label + " has an invalid estimatedMinutes");
        }
        return minutes;
    }

    private String requireText(JsonNode node, String label, String... fields) {
        String value = optionalText(node, fields);
        if (value == null) {
            throw new PlanParseException(label + " is missing a " + fields[0]);
        }
        return value;
    }

    private String optionalText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private int clamp(double minutes, int min, int max) {
        long rounded = Math.round(minutes);
        return (int) Math.max(min, Math.min(max, rounded));
    }

    private String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstNewline = content.indexOf('\n');
        int closingFence = content.lastIndexOf("```");
        if (firstNewline < 0 || closingFence <= firstNewline) {
            return content;
        }
        return content.substring(firstNewline + 1, closingFence).trim();
    }
}
