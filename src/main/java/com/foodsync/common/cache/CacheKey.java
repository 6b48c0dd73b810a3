package com.foodsync.common.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@link ResultCache}가 보관하는 항목. 키마다 별도 Caffeine 캐시라서 TTL이 서로 독립적이다.
 */
@Getter
@RequiredArgsConstructor
public enum CacheKey {

    MENU_TREE("menu:full"),             // 전체 메뉴 트리 (기본 1시간)
    DASHBOARD_STATS("dashboard:stats"); // 대시보드 집계 (기본 5분)

    private final String cacheName;
}
