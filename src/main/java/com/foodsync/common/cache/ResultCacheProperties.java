package com.foodsync.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "foodsync.cache")
public record ResultCacheProperties(
        @DefaultValue("1h") Duration menuTreeTtl,
        @DefaultValue("5m") Duration dashboardTtl
) {

    public Duration ttlOf(CacheKey key) {
        return switch (key) {
            case MENU_TREE -> menuTreeTtl;
            case DASHBOARD_STATS -> dashboardTtl;
        };
    }
}
