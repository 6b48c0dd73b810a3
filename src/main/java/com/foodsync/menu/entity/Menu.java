package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 동기화되는 메뉴의 루트.
 * 이 행은 동기화를 거쳐도 남고, 하위 트리(카테고리, 아이템, 사이즈, 그룹 링크)만 매번 다시 만든다.
 */
@Entity
@Table(name = "menus")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Menu {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long externalId;

    private Long restaurantExternalId;

    private String currency;

    private boolean active;

    private LocalDateTime syncedAt;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Menu(Long externalId, Long restaurantExternalId, String currency, boolean active) {
        this.externalId = externalId;
        this.restaurantExternalId = restaurantExternalId;
        this.currency = currency;
        this.active = active;
    }

    public void refresh(String currency, boolean active) {
        this.currency = currency;
        this.active = active;
    }

    public void markSynced() {
        this.syncedAt = LocalDateTime.now();
    }
}
