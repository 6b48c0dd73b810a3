package com.foodsync.eventlog;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EventType {

    ORDER_RECEIVED("order_received"),
    MENU_SYNC("menu_sync");

    private final String code;
}
