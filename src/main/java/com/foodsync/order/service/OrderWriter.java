package com.foodsync.order.service;

import com.foodsync.client.entity.Client;
import com.foodsync.client.service.ClientResolver;
import com.foodsync.common.cache.CacheKey;
import com.foodsync.common.cache.ResultCache;
import com.foodsync.order.entity.*;
import com.foodsync.order.payload.ExternalOrder;
import com.foodsync.order.repository.OrderRepository;
import com.foodsync.restaurant.entity.Restaurant;
import com.foodsync.restaurant.service.RestaurantResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 주문 저장기 - 검증된 주문 하나와 딸린 행 전부를 한 트랜잭션으로 저장한다.
 *
 * <h3>저장 대상</h3>
 * <pre>
 * clients, client_addresses   ← ClientResolver (MANDATORY)
 * restaurants                 ← RestaurantResolver (MANDATORY)
 * orders
 *  ├─ order_items → order_item_options
 *  ├─ order_taxes
 *  ├─ order_coupons
 *  └─ order_billing_details    (cascade, saveAndFlush 한 번)
 * </pre>
 *
 * <p>전부 커밋되거나 전부 롤백된다. 대시보드 캐시는 커밋 후에 무효화된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderWriter {

    private final OrderRepository orderRepository;
    private final ClientResolver clientResolver;
    private final RestaurantResolver restaurantResolver;
    private final ResultCache resultCache;

    /** 이미 저장된 주문이면 아무것도 쓰지 않고 isNew=false */
    @Transactional(timeout = 30)
    public OrderIngestResult write(ExternalOrder payload, String rawPayload) {
        long posSystemId = payload.posSystemIdOrDefault();

        Optional<Order> existing = orderRepository.findByExternalIdAndPosSystemId(payload.id(), posSystemId);
        if (existing.isPresent()) {
            log.debug("Order already stored: externalId={}, posSystemId={}", payload.id(), posSystemId);
            return new OrderIngestResult(payload.id(), existing.get().getId(), false);
        }

        Client client = clientResolver.resolve(payload).orElse(null);
        Restaurant restaurant = restaurantResolver.resolve(payload).orElse(null);

        Order order = Order.builder()
                .externalId(payload.id())
                .posSystemId(posSystemId)
                .restaurant(restaurant)
                .client(client)
                .status(payload.status())
                .type(OrderType.from(payload.type()))
                .source(payload.source())
                .currency(payload.currency())
                .totalPrice(payload.totalPrice())
                .subTotalPrice(payload.subTotalPrice())
                .taxValue(payload.taxValue())
                .taxType(payload.taxType())
                .taxName(payload.taxName())
                .paymentMethod(payload.isDelivery() ? payload.deliveryPayment() : payload.pickupPayment()) // 유형별 결제 수단
                .paymentStatus(payload.payment() != null ? payload.payment().paymentStatus() : null)
                .instructions(payload.instructions())
                .fulfillAt(payload.fulfillAt())
                .acceptedAt(payload.acceptedAt())
                .forLater(Boolean.TRUE.equals(payload.forLater()))
                .pinSkipped(Boolean.TRUE.equals(payload.pinSkipped()))
                .deliveryFee(firstLineTotal(payload, OrderItem.TYPE_DELIVERY_FEE))
                .deliveryAddress(payload.clientAddress())
                .deliveryLatitude(payload.latitude())
                .deliveryLongitude(payload.longitude())
                .deliveryZone(payload.deliveryZoneName())
                .outsideDeliveryArea(Boolean.TRUE.equals(payload.outsideDeliveryArea()))
                .tipAmount(firstLineTotal(payload, OrderItem.TYPE_TIP))
                .rawPayload(rawPayload)
                .build();

        payload.itemsOrEmpty().forEach(item -> order.addItem(toItem(item)));
        if (payload.taxList() != null) {
            payload.taxList().forEach(tax -> order.addTax(OrderTax.builder()
                    .type(tax.type())
                    .rate(tax.rate())
                    .amount(tax.value())
                    .build()));
        }
        if (payload.coupons() != null) {
            payload.coupons().forEach(code -> order.addCoupon(new OrderCoupon(code)));
        }
        if (payload.billingDetails() != null) {
            order.attachBilling(toBilling(payload.billingDetails()));
        }

        // 여기서 flush → 유니크 키 충돌이 이 호출 안에서 터진다
        Order saved = orderRepository.saveAndFlush(order);
        resultCache.invalidate(CacheKey.DASHBOARD_STATS);

        log.info("Order stored: externalId={}, posSystemId={}, id={}, items={}",
                payload.id(), posSystemId, saved.getId(), saved.getItems().size());
        return new OrderIngestResult(payload.id(), saved.getId(), true);
    }

    private BigDecimal firstLineTotal(ExternalOrder payload, String lineType) {
        return payload.itemsOrEmpty().stream()
                .filter(item -> lineType.equals(item.type()))
                .findFirst()
                .map(ExternalOrder.Item::totalItemPrice)
                .orElse(BigDecimal.ZERO);
    }

    private OrderItem toItem(ExternalOrder.Item item) {
        OrderItem orderItem = OrderItem.builder()
                .externalId(item.id())
                .name(item.name())
                .type(item.type())
                .typeId(item.typeId())
                .quantity(item.quantity())
                .price(item.price())
                .totalPrice(item.totalItemPrice())
                .taxRate(item.taxRate())
                .taxValue(item.taxValue())
                .taxType(item.taxType())
                .itemDiscount(item.itemDiscount())
                .cartDiscount(item.cartDiscount())
                .cartDiscountRate(item.cartDiscountRate())
                .instructions(item.instructions())
                .kitchenInternalName(item.kitchenInternalName())
                .coupon(item.coupon())
                .build();

        item.optionsOrEmpty().forEach(option -> orderItem.addOption(OrderItemOption.builder()
                .externalId(option.id())
                .name(option.name())
                .groupName(option.groupName())
                .type(option.type())
                .typeId(option.typeId())
                .quantity(option.quantity())
                .price(option.price())
                .kitchenInternalName(option.kitchenInternalName())
                .build()));
        return orderItem;
    }

    private BillingDetails toBilling(ExternalOrder.BillingInfo billing) {
        return BillingDetails.builder()
                .type(billing.type())
                .companyName(billing.companyName())
                .cui(billing.cui())
                .regCom(billing.regCom())
                .personName(billing.personName())
                .personType(billing.personType())
                .documentType(billing.documentType())
                .documentNumber(billing.documentNumber())
                .address(billing.address())
                .city(billing.city())
                .region(billing.region())
                .sector(billing.sector())
                .countryCode(billing.countryCode())
                .build();
    }
}
