package com.foodsync.order.entity;

import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum OrderType {
    PICKUP("pickup"),
    DELIVERY("delivery");

    private final String code;

    public static OrderType from(String code) {
        for (OrderType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_ORDER_PAYLOAD, "Unknown order type: " + code);
    }
}
