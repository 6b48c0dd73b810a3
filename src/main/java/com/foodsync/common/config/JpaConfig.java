package com.foodsync.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;

/**
 * JPA Auditing 설정. 엔티티의 {@code @CreatedDate}, {@code @LastModifiedDate}를 채운다.
 * 기간 집계 쿼리도 감사 시각과 같은 기본 시간대 Clock을 사용한다.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
