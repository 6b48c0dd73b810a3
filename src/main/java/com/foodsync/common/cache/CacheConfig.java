package com.foodsync.common.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 설정 (Cache Configuration)
 *
 * <p>{@link CacheKey}마다 Caffeine 로컬 캐시를 하나씩 등록하고, 각자 TTL을 따로 가진다.</p>
 *
 * <h3>★ 커밋 후 무효화</h3>
 * <p>CacheManager를 {@link TransactionAwareCacheManagerProxy}로 감싼다.
 * 트랜잭션 안에서 호출한 evict는 커밋 직후에 실행된다.</p>
 * <pre>
 *   @Transactional
 *   rebuild() {
 *       clearSubtree();                   // 1. 기존 트리 삭제
 *       insertTree();                     // 2. 새 트리 저장
 *       resultCache.invalidate(MENU_TREE); // 3. 이 시점에는 아직 evict 안 됨
 *   }                                     // 4. 커밋 → evict 실행
 *   // 롤백되면 evict도 없음 → 이전 트리 캐시 유지
 * </pre>
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(ResultCacheProperties properties) {
        CaffeineCacheManager caffeineCacheManager = new CaffeineCacheManager();
        for (CacheKey key : CacheKey.values()) {
            caffeineCacheManager.registerCustomCache(key.getCacheName(),
                    Caffeine.newBuilder()
                            .expireAfterWrite(properties.ttlOf(key))
                            .maximumSize(16) // 키당 엔트리 하나뿐, 여유분
                            .build());
        }
        return new TransactionAwareCacheManagerProxy(caffeineCacheManager);
    }
}
