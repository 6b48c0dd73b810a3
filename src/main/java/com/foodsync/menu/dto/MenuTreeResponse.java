package com.foodsync.menu.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * {@code GET /api/menu} 응답이자 {@code menu:full} 캐시 값. 모든 목록은 정렬 순서대로.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MenuTreeResponse(
        Long id,
        Long externalId,
        Long restaurantExternalId,
        String currency,
        boolean active,
        LocalDateTime syncedAt,
        List<CategoryView> categories) {

    public record CategoryView(Long id, Long externalId, String name, String description,
                               boolean active, int sortOrder, List<ItemView> items) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemView(Long id, Long externalId, String name, String description,
                           BigDecimal price, boolean active, int sortOrder, String kitchenInternalName,
                           JsonNode tags, JsonNode orderTypes, JsonNode allergens,
                           JsonNode nutritionalValues, JsonNode extras,
                           List<SizeView> sizes, List<GroupView> groups) {
    }

    public record SizeView(Long id, Long externalId, String name, BigDecimal price,
                           boolean isDefault, int sortOrder, List<GroupView> groups) {
    }

    public record GroupView(Long id, Long externalId, String name, boolean required,
                            boolean allowQuantity, int forceMin, int forceMax, List<OptionView> options) {
    }

    public record OptionView(Long id, Long externalId, String name, BigDecimal price,
                             boolean isDefault, String kitchenInternalName, int sortOrder) {
    }
}
