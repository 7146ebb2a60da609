package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * 创建或修改 webhook 的请求体。修改时未提供的字段保持原值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRequest {

    private String projectId;

    private String url;

    private Set<String> events;

    private String secret;

    private Map<String, String> headers;

    private String description;

    private Boolean enabled;
}
