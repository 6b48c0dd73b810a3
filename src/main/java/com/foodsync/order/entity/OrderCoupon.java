package com.foodsync.order.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "order_coupons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderCoupon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    @Column(nullable = false)
    private String couponCode;

    public OrderCoupon(String couponCode) {
        this.couponCode = couponCode;
    }
}
