package com.example.automation.controller;

import com.example.automation.model.DeliveryStatus;
import com.example.automation.repository.ScheduleRepository;
import com.example.automation.repository.WebhookDeliveryRepository;
import com.example.automation.repository.WebhookRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.HashMap;
import java.util.Map;

/**
 * 监控数据 API
 */
@RestController
@RequestMapping("/api/monitoring")
public class MonitoringApiController {

    @Autowired
    private HealthEndpoint healthEndpoint;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private ScheduleRepository scheduleRepository;

    @Autowired
    private WebhookRepository webhookRepository;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    /**
     * 获取系统概览数据
     */
    @GetMapping("/overview")
    public Map<String, Object> getOverview() {
        Map<String, Object> overview = new HashMap<>();

        // 健康状态
        overview.put("status", healthEndpoint.health().getStatus().getCode());

        // JVM 内存
        MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
        overview.put("memoryUsedMB", memoryBean.getHeapMemoryUsage().getUsed() / 1024 / 1024);
        overview.put("memoryMaxMB", memoryBean.getHeapMemoryUsage().getMax() / 1024 / 1024);
        long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        overview.put("uptimeMs", uptime);
        overview.put("uptimeFormatted", formatUptime(uptime));

        // 调度
        overview.put("totalSchedules", scheduleRepository.count());
        overview.put("enabledSchedules", scheduleRepository.countByEnabledTrue());
        overview.put("scheduleRunsCompleted", counterValue("automation.schedule.runs", "status", "completed"));
        overview.put("scheduleRunsFailed", counterValue("automation.schedule.runs", "status", "failed"));

        // Webhook 投递
        overview.put("totalWebhooks", webhookRepository.count());
        overview.put("enabledWebhooks", webhookRepository.countByEnabledTrue());
        long successful = deliveryRepository.countByStatus(DeliveryStatus.SUCCESS);
        long failed = deliveryRepository.countByStatus(DeliveryStatus.FAILED);
        overview.put("pendingDeliveries", deliveryRepository.countByStatus(DeliveryStatus.PENDING));
        overview.put("successfulDeliveries", successful);
        overview.put("failedDeliveries", failed);

        long finished = successful + failed;
        double successRate = finished > 0 ? (successful * 100.0 / finished) : 0;
        overview.put("successRate", String.format("%.1f", successRate));

        return overview;
    }

    private double counterValue(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter != null ? counter.count() : 0;
    }

    /**
     * 格式化运行时间
     */
    private String formatUptime(long uptimeMs) {
        long seconds = uptimeMs / 1000;
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm", days, hours, minutes);
        } else if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}
