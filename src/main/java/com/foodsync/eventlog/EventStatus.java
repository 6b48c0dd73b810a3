package com.foodsync.eventlog;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EventStatus {

    SUCCESS("success"),
    ERROR("error");

    private final String code;
}
