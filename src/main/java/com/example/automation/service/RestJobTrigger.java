package com.example.automation.service;

import com.example.automation.model.TriggerSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 通过任务服务的内部接口启动任务。
 * <p>
 * 请求体 {"project_id": ..., "trigger": "scheduled" | "manual"}，响应体需包含 job_id。
 * 4xx 表示业务拒绝（无可用目标、已有任务在运行），其余错误视为调用失败。
 */
@Service
@Slf4j
public class RestJobTrigger implements JobTrigger {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String triggerUrl;
    private final Duration timeout;

    public RestJobTrigger(ObjectMapper objectMapper,
            @Value("${app.jobs.trigger-url}") String triggerUrl,
            @Value("${app.jobs.timeout-seconds:10}") long timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.triggerUrl = triggerUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public String triggerJob(String projectId, TriggerSource source) throws JobTriggerException {
        Map<String, Object> body = requestBody(projectId, source);

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(triggerUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new JobTriggerException("Job service timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new JobTriggerException("Job service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobTriggerException("Interrupted while triggering job", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new JobTriggerException("Job service rejected project " + projectId
                    + ": HTTP " + status + " " + abbreviate(response.body()));
        }

        try {
            JsonNode jobId = objectMapper.readTree(response.body()).get("job_id");
            if (jobId == null || jobId.isNull()) {
                throw new JobTriggerException("Job service response has no job_id");
            }
            log.debug("Job {} started for project {}", jobId.asText(), projectId);
            return jobId.asText();
        } catch (JsonProcessingException e) {
            throw new JobTriggerException("Unreadable job service response", e);
        }
    }

    static Map<String, Object> requestBody(String projectId, TriggerSource source) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", projectId);
        body.put("trigger", source.name().toLowerCase(Locale.ROOT));
        return body;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
