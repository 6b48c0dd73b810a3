package com.foodsync.menu.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.menu.payload.ItemExtras;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 메뉴 아이템 자유 형식 컬럼의 JSON 텍스트 변환기.
 * 대상: 주문 유형, 태그, 알레르기, 영양 정보, 나머지 extras.
 *
 * <p>null과 빈 값은 {@code null}로 저장한다. 읽을 때 풀고, 읽기 실패로 조회가
 * 깨지지 않는다. 읽을 수 없는 값은 JSON 문자열로 돌려준다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MenuItemAttributes {

    private final ObjectMapper objectMapper;

    public String encode(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node && (node.isNull() || node.isMissingNode())) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_MENU_SNAPSHOT,
                    "Menu item attribute is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeResidual(ItemExtras extras) {
        if (extras == null || extras.getResidual().isEmpty()) {
            return null;
        }
        return encode(extras.getResidual());
    }

    /** {@link #decode(String)}와 같되 값이 없으면 빈 배열 */
    public JsonNode decodeOrEmpty(String json) {
        return json != null ? decode(json) : objectMapper.createArrayNode();
    }

    public JsonNode decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored menu item attribute is not valid JSON, returning raw text: {}", e.getOriginalMessage());
            return objectMapper.getNodeFactory().textNode(json);
        }
    }
}
