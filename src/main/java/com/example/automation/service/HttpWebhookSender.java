package com.example.automation.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 JDK HttpClient 的投递实现，不跟随重定向。
 */
@Service
@Slf4j
public class HttpWebhookSender implements WebhookSender {

    // HttpClient 自行管理的请求头
    private static final Set<String> RESTRICTED_HEADERS = Set.of("content-length", "host", "connection", "expect", "upgrade");

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    @Override
    public WebhookResponse send(URI url, byte[] body, Map<String, String> headers, Duration timeout) {
        long start = System.nanoTime();
        HttpRequest request;
        try {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                    .uri(url)
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body));

            headers.forEach((key, value) -> {
                if (!RESTRICTED_HEADERS.contains(key.toLowerCase())) {
                    requestBuilder.header(key, value);
                }
            });
            request = requestBuilder.build();
        } catch (IllegalArgumentException e) {
            log.warn("Webhook request rejected: {} - {}", url, e.getMessage());
            return WebhookResponse.failure("Invalid request: " + e.getMessage(), elapsedMs(start));
        }

        // 超时覆盖整个交换（含响应体读取），请求本身的 timeout 只限制等待响应头
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            HttpResponse<String> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new WebhookResponse(response.statusCode(), response.body(), elapsedMs(start), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Webhook delivery timed out: {}", url);
            return timedOut(timeout, start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                log.warn("Webhook delivery timed out: {}", url);
                return timedOut(timeout, start);
            }
            log.warn("Webhook delivery error: {} - {}", url, cause.getMessage());
            return WebhookResponse.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsedMs(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return WebhookResponse.failure("Interrupted", elapsedMs(start));
        }
    }

    private static WebhookResponse timedOut(Duration timeout, long start) {
        return WebhookResponse.failure("Request timed out after " + timeout.toSeconds() + "s", elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
