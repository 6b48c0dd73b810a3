package com.foodsync.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 라인. 일반 아이템 외에 배달비, 팁, 할인도 type으로 구분해 같은 테이블에 둔다
 * ({@code delivery_fee}, {@code tip}, {@code promo_cart} 등).
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    public static final String TYPE_TIP = "tip";
    public static final String TYPE_DELIVERY_FEE = "delivery_fee";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    @OneToMany(mappedBy = "orderItem", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItemOption> options = new ArrayList<>();

    private Long externalId;

    private String name;

    private String type;

    private Long typeId;

    private int quantity;

    private BigDecimal price;

    private BigDecimal totalPrice;

    private BigDecimal taxRate;

    private BigDecimal taxValue;

    private String taxType;

    private BigDecimal itemDiscount;

    private BigDecimal cartDiscount;

    private BigDecimal cartDiscountRate;

    @Column(length = 1000)
    private String instructions;

    private String kitchenInternalName;

    private String coupon;

    @Builder
    public OrderItem(Long externalId, String name, String type, Long typeId, Integer quantity,
                     BigDecimal price, BigDecimal totalPrice, BigDecimal taxRate, BigDecimal taxValue,
                     String taxType, BigDecimal itemDiscount, BigDecimal cartDiscount,
                     BigDecimal cartDiscountRate, String instructions, String kitchenInternalName,
                     String coupon) {
        this.externalId = externalId;
        this.name = name;
        this.type = type;
        this.typeId = typeId;
        this.quantity = quantity != null ? quantity : 1;
        this.price = orZero(price);
        this.totalPrice = orZero(totalPrice);
        this.taxRate = orZero(taxRate);
        this.taxValue = orZero(taxValue);
        this.taxType = taxType;
        this.itemDiscount = orZero(itemDiscount);
        this.cartDiscount = orZero(cartDiscount);
        this.cartDiscountRate = orZero(cartDiscountRate);
        this.instructions = instructions;
        this.kitchenInternalName = kitchenInternalName;
        this.coupon = coupon;
    }

    public void addOption(OrderItemOption option) {
        options.add(option);
        option.setOrderItem(this);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
