package com.example.automation.controller;

import com.example.automation.event.JobEvent;
import com.example.automation.event.JobEventPublisher;
import com.example.automation.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * 领域事件入口：任务执行方把生命周期事件推到这里，入队后立即返回 202。
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventIngestController {

    private final JobEventPublisher publisher;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<Map<String, String>> ingest(@RequestBody JobEvent event) {
        if (event.getEventType() == null) {
            throw new InvalidRequestException("event_type is required");
        }
        if (event.getUserId() == null || event.getUserId().isBlank()) {
            throw new InvalidRequestException("user_id is required");
        }
        if (event.getOccurredAt() == null) {
            event.setOccurredAt(clock.instant());
        }

        publisher.publish(event);
        log.debug("Accepted {} for project {}", event.getEventType(), event.getProjectId());
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }
}
