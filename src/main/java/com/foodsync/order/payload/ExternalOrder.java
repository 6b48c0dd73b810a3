package com.foodsync.order.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.util.List;

/**
 * 플랫폼이 보낸 주문 하나 (push, poll 공통).
 *
 * <p>모르는 필드는 무시한다. 원본 JSON은 raw payload로 따로 보관되므로 잃는 정보는 없다.
 * 필수 값은 {@code id}, {@code type}, {@code total_price}뿐이고
 * {@code restaurant_key}가 없으면 매장 없이 저장된다.</p>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalOrder(
        @NotNull Long id,
        String status,
        @NotBlank @Pattern(regexp = "pickup|delivery") String type,
        String source,
        String restaurantKey,
        Long restaurantId,
        String restaurantName,
        String restaurantTimezone,
        Long posSystemId,
        String currency,
        @NotNull BigDecimal totalPrice,
        BigDecimal subTotalPrice,
        BigDecimal taxValue,
        String taxType,
        String taxName,
        List<TaxLine> taxList,
        List<String> coupons,
        String instructions,
        String fulfillAt,
        String acceptedAt,
        Boolean forLater,
        Boolean pinSkipped,
        String pickupPayment,
        String deliveryPayment,
        PaymentInfo payment,
        List<Item> items,
        Long clientId,
        Long userId,
        String clientFirstName,
        String clientLastName,
        String clientEmail,
        String clientPhone,
        String clientAddress,
        AddressParts clientAddressParts,
        Integer clientOrderCount,
        Boolean clientMarketingConsent,
        String latitude,
        String longitude,
        String deliveryZoneName,
        Boolean outsideDeliveryArea,
        BillingInfo billingDetails) {

    public static final long DEFAULT_POS_SYSTEM_ID = 0L;

    public long posSystemIdOrDefault() {
        return posSystemId != null ? posSystemId : DEFAULT_POS_SYSTEM_ID;
    }

    public Long clientExternalId() {
        return clientId != null ? clientId : userId;
    }

    public boolean isDelivery() {
        return "delivery".equals(type);
    }

    public List<Item> itemsOrEmpty() {
        return items != null ? items : List.of();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            Long id,
            String name,
            BigDecimal totalItemPrice,
            BigDecimal price,
            Integer quantity,
            String instructions,
            String type,
            Long typeId,
            BigDecimal taxRate,
            BigDecimal taxValue,
            String taxType,
            Long parentId,
            BigDecimal itemDiscount,
            BigDecimal cartDiscount,
            BigDecimal cartDiscountRate,
            String kitchenInternalName,
            String coupon,
            List<Option> options) {

        public List<Option> optionsOrEmpty() {
            return options != null ? options : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Option(
            Long id,
            String name,
            BigDecimal price,
            String groupName,
            Integer quantity,
            String type,
            Long typeId,
            String kitchenInternalName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaxLine(String type, BigDecimal value, BigDecimal rate) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentInfo(
            String paymentStatus,
            String paymentProcessor,
            String paymentMethod,
            String cardType) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AddressParts(
            String street,
            String bloc,
            String floor,
            String apartment,
            String intercom,
            String moreAddress,
            String zipcode,
            String city,
            String fullAddress) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BillingInfo(
            String type,
            String companyName,
            String cui,
            String regCom,
            String personName,
            String personType,
            String documentType,
            String documentNumber,
            String address,
            String city,
            String region,
            String sector,
            String countryCode) {
    }
}
