package com.foodsync.common.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 결과 캐시 (Result Cache)
 *
 * <p>계산 비용이 큰 조회 결과(전체 메뉴 트리, 대시보드 집계)를 보관한다.
 * 데이터를 바꾸는 파이프라인은 성공할 때마다 {@link #invalidate(CacheKey)}를 호출한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   return resultCache.get(CacheKey.MENU_TREE, MenuTreeResponse.class)
 *           .orElseGet(() -> {
 *               MenuTreeResponse tree = loadTree();
 *               resultCache.put(CacheKey.MENU_TREE, tree);
 *               return tree;
 *           });
 * </pre>
 *
 * <p>트랜잭션 안에서의 무효화는 커밋까지 미뤄진다 ({@link CacheConfig} 참고).</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultCache {

    private static final String ENTRY = "snapshot"; // 캐시마다 엔트리 하나

    private final CacheManager cacheManager;

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return Optional.ofNullable(cacheOf(key).get(ENTRY, type));
    }

    public void put(CacheKey key, Object value) {
        cacheOf(key).put(ENTRY, value);
    }

    public void invalidate(CacheKey key) {
        cacheOf(key).evict(ENTRY);
        log.debug("Cache entry invalidated: {}", key.getCacheName());
    }

    private Cache cacheOf(CacheKey key) {
        Cache cache = cacheManager.getCache(key.getCacheName());
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + key.getCacheName());
        }
        return cache;
    }
}
