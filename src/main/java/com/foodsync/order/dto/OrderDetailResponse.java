package com.foodsync.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodsync.client.entity.Client;
import com.foodsync.order.entity.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 상세 응답.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderDetailResponse(
        Long id,
        Long externalId,
        Long posSystemId,
        String restaurantKey,
        String status,
        String type,
        String source,
        String currency,
        BigDecimal totalPrice,
        BigDecimal subTotalPrice,
        BigDecimal taxValue,
        String taxType,
        String taxName,
        String paymentMethod,
        String paymentStatus,
        String instructions,
        String fulfillAt,
        String acceptedAt,
        boolean forLater,
        BigDecimal deliveryFee,
        String deliveryAddress,
        String deliveryZone,
        BigDecimal tipAmount,
        LocalDateTime createdAt,
        ClientView client,
        List<ItemView> items,
        List<TaxView> taxes,
        List<String> coupons,
        BillingView billing) {

    public static OrderDetailResponse of(Order order, List<OrderItem> items) {
        return new OrderDetailResponse(
                order.getId(),
                order.getExternalId(),
                order.getPosSystemId(),
                order.getRestaurant() != null ? order.getRestaurant().getRestaurantKey() : null,
                order.getStatus(),
                order.getType().getCode(),
                order.getSource(),
                order.getCurrency(),
                order.getTotalPrice(),
                order.getSubTotalPrice(),
                order.getTaxValue(),
                order.getTaxType(),
                order.getTaxName(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getInstructions(),
                order.getFulfillAt(),
                order.getAcceptedAt(),
                order.isForLater(),
                order.getDeliveryFee(),
                order.getDeliveryAddress(),
                order.getDeliveryZone(),
                order.getTipAmount(),
                order.getCreatedAt(),
                order.getClient() != null ? ClientView.from(order.getClient()) : null,
                items.stream().map(ItemView::from).toList(),
                order.getTaxes().stream().map(TaxView::from).toList(),
                order.getCoupons().stream().map(OrderCoupon::getCouponCode).toList(),
                order.getBillingDetails() != null ? BillingView.from(order.getBillingDetails()) : null);
    }

    public record ClientView(Long id, String firstName, String lastName, String email, String phone) {
        static ClientView from(Client client) {
            return new ClientView(client.getId(), client.getFirstName(), client.getLastName(),
                    client.getEmail(), client.getPhone());
        }
    }

    public record ItemView(Long id, Long externalId, String name, String type, int quantity,
                           BigDecimal price, BigDecimal totalPrice, String instructions,
                           List<OptionView> options) {
        static ItemView from(OrderItem item) {
            return new ItemView(item.getId(), item.getExternalId(), item.getName(), item.getType(),
                    item.getQuantity(), item.getPrice(), item.getTotalPrice(), item.getInstructions(),
                    item.getOptions().stream().map(OptionView::from).toList());
        }
    }

    public record OptionView(Long id, String name, String groupName, String type,
                             int quantity, BigDecimal price) {
        static OptionView from(OrderItemOption option) {
            return new OptionView(option.getId(), option.getName(), option.getGroupName(),
                    option.getType(), option.getQuantity(), option.getPrice());
        }
    }

    public record TaxView(String type, BigDecimal rate, BigDecimal amount) {
        static TaxView from(OrderTax tax) {
            return new TaxView(tax.getType(), tax.getRate(), tax.getAmount());
        }
    }

    public record BillingView(String type, String companyName, String personName,
                              String documentType, String documentNumber, String address,
                              String city, String countryCode) {
        static BillingView from(BillingDetails billing) {
            return new BillingView(billing.getType(), billing.getCompanyName(), billing.getPersonName(),
                    billing.getDocumentType(), billing.getDocumentNumber(), billing.getAddress(),
                    billing.getCity(), billing.getCountryCode());
        }
    }
}
