package com.foodsync.menu.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 메뉴 동기화 설정 ({@code foodsync.menu-sync.*}).
 *
 * @param cron           정기 동기화 cron, {@code -}면 비활성
 * @param rebuildTimeout 동기화 한 번의 재구성 기한
 */
@ConfigurationProperties(prefix = "foodsync.menu-sync")
public record MenuSyncProperties(
        @DefaultValue("0 0 */6 * * *") String cron,
        @DefaultValue("2m") Duration rebuildTimeout) {
}
