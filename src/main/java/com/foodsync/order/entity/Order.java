package com.foodsync.order.entity;

import com.foodsync.client.entity.Client;
import com.foodsync.restaurant.entity.Restaurant;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 정규화된 주문 엔티티.
 *
 * <p>(externalId, posSystemId)가 유일한 중복 기준이고 유니크 제약으로 강제된다.</p>
 *
 * <p>아이템, 세금, 쿠폰, 청구 정보는 주문이 소유하며 cascade로 저장된다.
 * 저장 한 번으로 전체가 기록된다.</p>
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_orders_external_pos",
                columnNames = {"external_id", "pos_system_id"}),
        indexes = @Index(name = "idx_orders_created_at", columnList = "created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false)
    private Long externalId;

    @Column(name = "pos_system_id", nullable = false)
    private Long posSystemId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "restaurant_id")
    private Restaurant restaurant;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id")
    private Client client;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderTax> taxes = new ArrayList<>();

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderCoupon> coupons = new ArrayList<>();

    @OneToOne(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private BillingDetails billingDetails;

    private String status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderType type;

    private String source;

    private String currency;

    @Column(nullable = false)
    private BigDecimal totalPrice;

    private BigDecimal subTotalPrice;

    private BigDecimal taxValue;

    private String taxType;

    private String taxName;

    private String paymentMethod;

    private String paymentStatus;

    @Column(length = 1000)
    private String instructions;

    private String fulfillAt;

    private String acceptedAt;

    private boolean forLater;

    private boolean pinSkipped;

    private BigDecimal deliveryFee;

    @Column(length = 500)
    private String deliveryAddress;

    private String deliveryLatitude;

    private String deliveryLongitude;

    private String deliveryZone;

    private boolean outsideDeliveryArea;

    private BigDecimal tipAmount;

    @Column(columnDefinition = "TEXT")
    private String rawPayload;

    @CreatedDate
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(Long externalId, Long posSystemId, Restaurant restaurant, Client client,
                 String status, OrderType type, String source, String currency,
                 BigDecimal totalPrice, BigDecimal subTotalPrice, BigDecimal taxValue,
                 String taxType, String taxName, String paymentMethod, String paymentStatus,
                 String instructions, String fulfillAt, String acceptedAt,
                 boolean forLater, boolean pinSkipped, BigDecimal deliveryFee,
                 String deliveryAddress, String deliveryLatitude, String deliveryLongitude,
                 String deliveryZone, boolean outsideDeliveryArea, BigDecimal tipAmount,
                 String rawPayload) {
        this.externalId = externalId;
        this.posSystemId = posSystemId;
        this.restaurant = restaurant;
        this.client = client;
        this.status = status;
        this.type = type;
        this.source = source;
        this.currency = currency;
        this.totalPrice = totalPrice;
        this.subTotalPrice = subTotalPrice;
        this.taxValue = taxValue != null ? taxValue : BigDecimal.ZERO;
        this.taxType = taxType;
        this.taxName = taxName;
        this.paymentMethod = paymentMethod;
        this.paymentStatus = paymentStatus != null ? paymentStatus : "pending";
        this.instructions = instructions;
        this.fulfillAt = fulfillAt;
        this.acceptedAt = acceptedAt;
        this.forLater = forLater;
        this.pinSkipped = pinSkipped;
        this.deliveryFee = deliveryFee != null ? deliveryFee : BigDecimal.ZERO;
        this.deliveryAddress = deliveryAddress;
        this.deliveryLatitude = deliveryLatitude;
        this.deliveryLongitude = deliveryLongitude;
        this.deliveryZone = deliveryZone;
        this.outsideDeliveryArea = outsideDeliveryArea;
        this.tipAmount = tipAmount != null ? tipAmount : BigDecimal.ZERO;
        this.rawPayload = rawPayload;
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    public void addTax(OrderTax tax) {
        taxes.add(tax);
        tax.setOrder(this);
    }

    public void addCoupon(OrderCoupon coupon) {
        coupons.add(coupon);
        coupon.setOrder(this);
    }

    public void attachBilling(BillingDetails billing) {
        this.billingDetails = billing;
        billing.setOrder(this);
    }
}
