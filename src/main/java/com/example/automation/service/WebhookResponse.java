package com.example.automation.service;

/**
 * 一次 HTTP 投递的结果。statusCode 为空表示未收到响应（超时或网络错误）。
 */
public record WebhookResponse(Integer statusCode, String body, long durationMs, String error) {

    public boolean isSuccess() {
        return error == null && statusCode != null && statusCode >= 200 && statusCode < 300;
    }

    public static WebhookResponse failure(String error, long durationMs) {
        return new WebhookResponse(null, null, durationMs, error);
    }
}
