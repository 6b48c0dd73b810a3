package com.foodsync.menu.service;

/**
 * 동기화 한 번의 집계. {@code optionGroups}, {@code options}는 이번에 새로 만든 행만 센다.
 */
public record MenuSyncResult(int categories, int items, int sizes, int optionGroups, int options) {
}
