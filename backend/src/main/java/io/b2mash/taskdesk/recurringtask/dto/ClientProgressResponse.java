package io.b2mash.taskdesk.recurringtask.dto;

import java.util.List;

public record ClientProgressResponse(
    String clientId, int completed, int total, int percentage, List<String> completedPeriods) {}
