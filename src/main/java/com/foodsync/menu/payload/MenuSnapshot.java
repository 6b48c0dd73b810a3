package com.foodsync.menu.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/**
 * {@code GET /pos/menu} 응답 전체 (카테고리 → 아이템 → 사이즈, 그리고 옵션 그룹과 옵션).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MenuSnapshot(
        Long id,
        Long restaurantId,
        boolean active,
        String currency,
        List<CategoryPayload> categories) {

    public List<CategoryPayload> categoriesOrEmpty() {
        return categories != null ? categories : List.of();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CategoryPayload(
            Long id,
            String name,
            String description,
            boolean active,
            List<ItemPayload> items,
            List<OptionGroupPayload> groups) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ItemPayload(
            Long id,
            String name,
            String description,
            BigDecimal price,
            boolean active,
            List<String> tags,
            List<SizePayload> sizes,
            List<OptionGroupPayload> groups,
            ItemExtras extras) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SizePayload(
            Long id,
            String name,
            BigDecimal price,
            @JsonProperty("default") boolean isDefault,
            List<OptionGroupPayload> groups) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionGroupPayload(
            Long id,
            String name,
            boolean required,
            boolean allowQuantity,
            int forceMin,
            int forceMax,
            List<OptionPayload> options) {

        public List<OptionPayload> optionsOrEmpty() {
            return options != null ? options : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionPayload(
            Long id,
            String name,
            BigDecimal price,
            @JsonProperty("default") boolean isDefault,
            OptionExtras extras) {

        public String kitchenInternalName() {
            return extras != null ? extras.menuOptionKitchenInternalName() : null;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionExtras(String menuOptionKitchenInternalName) {
    }
}
