package com.example.automation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 可订阅的领域事件类型，wireName 即 payload 中的 event 字段。
 */
public enum EventType {
    JOB_STARTED("job.started"),
    JOB_COMPLETED("job.completed"),
    JOB_FAILED("job.failed"),
    JOB_PROGRESS("job.progress"),
    ANALYSIS_COMPLETED("analysis.completed"),
    RESULTS_AVAILABLE("results.available"),
    PROJECT_CREATED("project.created"),
    PROJECT_UPDATED("project.updated"),
    PROJECT_DELETED("project.deleted"),
    TARGET_ADDED("target.added"),
    TARGET_ERROR("target.error"),
    SCHEDULE_TRIGGERED("schedule.triggered"),
    SCHEDULE_FAILED("schedule.failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> find(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }

    @JsonCreator
    public static EventType fromWireName(String wireName) {
        return find(wireName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + wireName));
    }
}
