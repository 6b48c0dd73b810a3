package com.foodsync.common.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCacheTest {

    private ResultCache resultCache;

    @BeforeEach
    void setUp() {
        ResultCacheProperties properties = new ResultCacheProperties(Duration.ofHours(1), Duration.ofMinutes(5));
        resultCache = new ResultCache(new CacheConfig().cacheManager(properties));
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("저장한 값은 무효화 전까지 그대로 반환")
    void putThenGet_ReturnsCachedValue() {
        resultCache.put(CacheKey.DASHBOARD_STATS, "stats");

        assertThat(resultCache.get(CacheKey.DASHBOARD_STATS, String.class)).contains("stats");
        assertThat(resultCache.get(CacheKey.MENU_TREE, String.class)).isEmpty();

        resultCache.invalidate(CacheKey.DASHBOARD_STATS);

        assertThat(resultCache.get(CacheKey.DASHBOARD_STATS, String.class)).isEmpty();
    }

    @Test
    @DisplayName("키마다 독립적으로 무효화")
    void invalidate_OnlyTouchesGivenKey() {
        resultCache.put(CacheKey.DASHBOARD_STATS, "stats");
        resultCache.put(CacheKey.MENU_TREE, "tree");

        resultCache.invalidate(CacheKey.MENU_TREE);

        assertThat(resultCache.get(CacheKey.MENU_TREE, String.class)).isEmpty();
        assertThat(resultCache.get(CacheKey.DASHBOARD_STATS, String.class)).contains("stats");
    }

    @Test
    @DisplayName("트랜잭션 안의 무효화는 커밋 후에 적용")
    void invalidate_InsideTransaction_DeferredUntilCommit() {
        // Given
        resultCache.put(CacheKey.MENU_TREE, "old tree");
        TransactionSynchronizationManager.initSynchronization();

        // When
        resultCache.invalidate(CacheKey.MENU_TREE);

        // Then
        assertThat(resultCache.get(CacheKey.MENU_TREE, String.class)).contains("old tree");

        TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
        assertThat(resultCache.get(CacheKey.MENU_TREE, String.class)).isEmpty();
    }
}
