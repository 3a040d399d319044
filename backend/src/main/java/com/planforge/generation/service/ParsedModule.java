package com.planforge.generation.service;

import java.util.List;

public record ParsedModule(
        String title,
        String description,
        int estimatedMinutes,
        List<ParsedTask> tasks
) {
}
