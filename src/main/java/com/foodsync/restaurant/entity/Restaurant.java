package com.foodsync.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "restaurants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Restaurant {

    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true)
    private Long externalId;

    /**
     * find-or-create 조회 키. 주문은 플랫폼 숫자 id가 아니라 이 키로 매장을 가리킨다.
     */
    @Column(nullable = false, unique = true)
    private String restaurantKey;

    @Column(nullable = false)
    private String name;

    private String timezone;

    private String currency;

    private boolean active;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Restaurant(Long externalId, String restaurantKey, String name,
                      String timezone, String currency) {
        this.externalId = externalId;
        this.restaurantKey = restaurantKey;
        this.name = name;
        this.timezone = timezone != null ? timezone : DEFAULT_TIMEZONE;
        this.currency = currency;
        this.active = true;
    }
}
