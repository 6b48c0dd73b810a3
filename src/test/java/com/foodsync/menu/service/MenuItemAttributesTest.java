package com.foodsync.menu.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodsync.menu.payload.ItemExtras;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MenuItemAttributesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MenuItemAttributes attributes = new MenuItemAttributes(objectMapper);

    @Test
    @DisplayName("null과 JSON null은 저장하지 않음")
    void encode_NullValues_StoredAsNull() {
        assertThat(attributes.encode(null)).isNull();
        assertThat(attributes.encode(objectMapper.nullNode())).isNull();
        assertThat(attributes.encode(List.of("pickup", "delivery"))).isEqualTo("[\"pickup\",\"delivery\"]");
    }

    @Test
    @DisplayName("전용 컬럼이 없는 extras 키만 잔여 JSON으로 저장")
    void encodeResidual_KeepsOnlyUnmappedKeys() throws Exception {
        // Given
        ItemExtras extras = objectMapper.readValue(
                "{\"menu_item_order_types\":[\"pickup\"],"
                        + "\"menu_item_kitchen_internal_name\":\"PZ-1\","
                        + "\"menu_item_allergens_values\":[{\"id\":1}],"
                        + "\"spicy_level\":2}",
                ItemExtras.class);

        // When
        String residual = attributes.encodeResidual(extras);

        // Then
        assertThat(extras.getKitchenInternalName()).isEqualTo("PZ-1");
        assertThat(extras.getOrderTypes()).containsExactly("pickup");
        assertThat(residual).isEqualTo("{\"spicy_level\":2}");
    }

    @Test
    @DisplayName("잔여 키가 없으면 null")
    void encodeResidual_NothingLeft_Null() throws Exception {
        ItemExtras extras = objectMapper.readValue("{\"menu_item_kitchen_internal_name\":\"PZ-1\"}", ItemExtras.class);

        assertThat(attributes.encodeResidual(extras)).isNull();
        assertThat(attributes.encodeResidual(null)).isNull();
    }

    @Test
    @DisplayName("손상된 JSON은 읽기를 실패시키지 않고 문자열로 반환")
    void decode_InvalidJson_ReturnsText() {
        JsonNode node = attributes.decode("[not json");

        assertThat(node.isTextual()).isTrue();
        assertThat(node.asText()).isEqualTo("[not json");
    }

    @Test
    @DisplayName("값이 없으면 빈 배열")
    void decodeOrEmpty_Missing_EmptyArray() {
        assertThat(attributes.decodeOrEmpty(null).isArray()).isTrue();
        assertThat(attributes.decodeOrEmpty(null)).isEmpty();
        assertThat(attributes.decodeOrEmpty("[\"vegan\"]").get(0).asText()).isEqualTo("vegan");
    }
}
