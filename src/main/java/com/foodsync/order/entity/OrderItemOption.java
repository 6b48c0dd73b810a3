package com.foodsync.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "order_item_options")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItemOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_item_id", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private OrderItem orderItem;

    private Long externalId;

    private String name;

    private String groupName;

    /** {@code size} 또는 {@code option} */
    private String type;

    private Long typeId;

    private int quantity;

    private BigDecimal price;

    private String kitchenInternalName;

    @Builder
    public OrderItemOption(Long externalId, String name, String groupName, String type,
                           Long typeId, Integer quantity, BigDecimal price, String kitchenInternalName) {
        this.externalId = externalId;
        this.name = name;
        this.groupName = groupName;
        this.type = type;
        this.typeId = typeId;
        this.quantity = quantity != null ? quantity : 1;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.kitchenInternalName = kitchenInternalName;
    }
}
