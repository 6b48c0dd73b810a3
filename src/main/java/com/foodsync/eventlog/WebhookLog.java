package com.foodsync.eventlog;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 감사 로그 엔티티. 추가만 하고 수정하지 않는다.
 */
@Entity
@Table(name = "webhook_logs", indexes = {
        @Index(name = "idx_logs_created", columnList = "created_at"),
        @Index(name = "idx_logs_type", columnList = "event_type")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", nullable = false)
    private String eventType; // order_received | menu_sync

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String status; // success | error

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Builder
    public WebhookLog(EventType eventType, String payload, EventStatus status, String errorMessage) {
        this.eventType = eventType.getCode();
        this.payload = payload;
        this.status = status.getCode();
        this.errorMessage = errorMessage;
        this.createdAt = LocalDateTime.now();
    }
}
