package com.example.automation.event;

import com.example.automation.model.EventType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 任务生命周期等领域事件。data 中为事件特有字段（如 progress、results_count、error）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEvent {

    @JsonProperty("event_type")
    private EventType eventType;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("project_name")
    private String projectName;

    @JsonProperty("job_id")
    private String jobId;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    @JsonProperty("occurred_at")
    private Instant occurredAt;
}
