package com.foodsync.eventlog;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WebhookLogRepository extends JpaRepository<WebhookLog, Long> {

    List<WebhookLog> findByEventTypeOrderByCreatedAtDescIdDesc(String eventType, Pageable pageable);

    List<WebhookLog> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
