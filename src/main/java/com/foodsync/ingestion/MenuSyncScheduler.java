package com.foodsync.ingestion;

import com.foodsync.common.exception.BusinessException;
import com.foodsync.menu.service.MenuSyncResult;
import com.foodsync.menu.service.SyncTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 정기 메뉴 동기화 스케줄러.
 *
 * <p>{@code @SchedulerLock}으로 회차마다 한 인스턴스만 실행한다.
 * 실패는 동기화 쪽에서 이미 이벤트로 남기므로 여기서는 로그만 찍는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MenuSyncScheduler {

    private final IngestionGateway ingestionGateway;

    @Scheduled(cron = "${foodsync.menu-sync.cron:0 0 */6 * * *}") // 기본 6시간마다, "-"면 비활성
    @SchedulerLock(name = "menuSync", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void syncMenu() {
        try {
            MenuSyncResult result = ingestionGateway.syncMenu(SyncTrigger.SCHEDULED);
            log.info("Scheduled menu sync completed: {}", result);
        } catch (BusinessException e) {
            log.error("Scheduled menu sync failed: code={}, reason={}", e.getErrorCode(), e.getMessage());
        }
    }
}
