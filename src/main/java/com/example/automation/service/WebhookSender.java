package com.example.automation.service;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * 发送 webhook POST 请求。实现不得抛出异常，失败通过 {@link WebhookResponse#error()} 返回。
 */
public interface WebhookSender {

    WebhookResponse send(URI url, byte[] body, Map<String, String> headers, Duration timeout);
}
