package com.foodsync.menu.payload;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 메뉴 아이템의 열린 {@code extras} 객체.
 * 전용 컬럼이 있는 키는 필드로 받고, 나머지는 전부 {@link #getResidual()}로 모은다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PACKAGE)
public class ItemExtras {

    @JsonProperty("menu_item_order_types")
    private List<String> orderTypes;

    @JsonProperty("menu_item_kitchen_internal_name")
    private String kitchenInternalName;

    @JsonProperty("menu_item_allergens_values")
    private JsonNode allergens;

    @JsonProperty("menu_item_nutritional_values")
    private JsonNode nutritionalValues;

    private final Map<String, JsonNode> residual = new LinkedHashMap<>();

    @JsonAnySetter
    void putResidual(String key, JsonNode value) {
        residual.put(key, value);
    }
}
