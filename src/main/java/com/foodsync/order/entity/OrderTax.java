package com.foodsync.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "order_taxes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderTax {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    private String type;

    private BigDecimal rate;

    private BigDecimal amount;

    @Builder
    public OrderTax(String type, BigDecimal rate, BigDecimal amount) {
        this.type = type;
        this.rate = rate;
        this.amount = amount;
    }
}
