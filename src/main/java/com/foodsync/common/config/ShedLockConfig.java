package com.foodsync.common.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ShedLock 설정 - 스케줄 작업 중복 실행 방지.
 *
 * <p>인스턴스가 여러 대 떠 있어도 정기 메뉴 동기화는 한 인스턴스에서만 실행된다.
 * 락 행은 {@code schema.sql}이 만드는 {@code shedlock} 테이블에 저장된다.</p>
 *
 * <h3>동작 흐름</h3>
 * <pre>
 * 1. 인스턴스 A, B가 같은 cron 시각에 깨어남
 * 2. A가 shedlock 행 UPDATE 성공 → 동기화 실행
 * 3. B는 UPDATE 0건 → 이번 회차 건너뜀
 * 4. lockAtMostFor(10분)가 지나면 A가 죽었어도 락 자동 해제
 * </pre>
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .usingDbTime() // 인스턴스 간 시계 차이 대신 DB 시각 사용
                        .build());
    }
}
