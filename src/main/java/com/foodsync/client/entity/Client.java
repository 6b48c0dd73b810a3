package com.foodsync.client.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "clients")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true)
    private Long externalId; // 플랫폼 client_id (없으면 user_id)

    private String firstName;

    private String lastName;

    private String email;

    private String phone;

    private int orderCount;

    private boolean marketingConsent;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Client(Long externalId, String firstName, String lastName, String email,
                  String phone, int orderCount, boolean marketingConsent) {
        this.externalId = externalId;
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phone = phone;
        this.orderCount = orderCount;
        this.marketingConsent = marketingConsent;
    }

    /**
     * 비파괴 병합. null 인자는 저장된 값을 유지하고, 주문 수만 항상 교체한다.
     */
    public void merge(String firstName, String lastName, String email, String phone,
                      int orderCount, Boolean marketingConsent) {
        if (firstName != null) {
            this.firstName = firstName;
        }
        if (lastName != null) {
            this.lastName = lastName;
        }
        if (email != null) {
            this.email = email;
        }
        if (phone != null) {
            this.phone = phone;
        }
        if (marketingConsent != null) {
            this.marketingConsent = marketingConsent;
        }
        this.orderCount = orderCount;
    }
}
