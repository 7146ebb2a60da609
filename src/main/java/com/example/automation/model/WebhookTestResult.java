package com.example.automation.model;

/**
 * 测试推送结果。
 */
public record WebhookTestResult(boolean success, Integer statusCode, Long responseTimeMs, String error) {
}
