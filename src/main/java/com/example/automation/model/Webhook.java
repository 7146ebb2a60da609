package com.example.automation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Webhook 订阅：向指定 HTTPS 地址推送所订阅的事件。
 */
@Entity
@Table(name = "webhooks",
        indexes = @Index(name = "idx_webhook_user_enabled", columnList = "userId,enabled"))
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Webhook {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Column(length = 64)
    private String projectId; // 为空表示对该用户的所有项目生效

    @Column(nullable = false, length = 2048)
    private String url;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_event_types", joinColumns = @JoinColumn(name = "webhook_id"))
    @Column(name = "event_type", nullable = false, length = 64)
    @Builder.Default
    private Set<String> events = new LinkedHashSet<>();

    @Column(columnDefinition = "TEXT")
    @JsonIgnore
    private String secret; // 为空则不签名

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_headers", joinColumns = @JoinColumn(name = "webhook_id"))
    @MapKeyColumn(name = "header_name", length = 128)
    @Column(name = "header_value", length = 1024)
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Column(length = 500)
    private String description;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private int consecutiveFailures = 0;

    private Instant lastTriggeredAt;

    private Integer lastStatusCode;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    /**
     * 是否配置了签名密钥。
     */
    public boolean isSigned() {
        return secret != null && !secret.isEmpty();
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
