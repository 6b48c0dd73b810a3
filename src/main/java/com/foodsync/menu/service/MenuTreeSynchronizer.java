package com.foodsync.menu.service;

import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.eventlog.EventLogService;
import com.foodsync.eventlog.EventType;
import com.foodsync.gloriafood.GloriaFoodFetcher;
import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.menu.repository.MenuRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 메뉴 트리 동기화 (Menu Tree Synchronizer)
 *
 * <h3>동작 흐름</h3>
 * <pre>
 * FETCHING     GloriaFoodFetcher.fetchMenu()  → 실패 시 쓰기 없이 중단
 * RECONCILING  메뉴 행 확보 (없으면 생성, 동시 생성 충돌 시 다시 조회)
 * REBUILDING   MenuRebuilder.rebuild()        → 실패 시 롤백, 이전 트리 유지
 * FINALIZING   synced_at 갱신, 메뉴 캐시 무효화
 * DONE         menu_sync success 이벤트 (집계 포함)
 * </pre>
 *
 * <p>어느 단계에서 실패하든 FAILED로 가고 menu_sync error 이벤트를 원인과 함께 남긴다.
 * BusinessException이 아닌 예외는 {@code PERSISTENCE_FAILED}로 감싼다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MenuTreeSynchronizer {

    private final GloriaFoodFetcher gloriaFoodFetcher;
    private final MenuRegistrar menuRegistrar;
    private final MenuRebuilder menuRebuilder;
    private final MenuRepository menuRepository;
    private final EventLogService eventLogService;
    private final MenuSyncProperties properties;

    public MenuSyncResult sync(SyncTrigger trigger) {
        SyncRun run = new SyncRun(trigger, Instant.now().plus(properties.rebuildTimeout()));
        try {
            MenuSnapshot snapshot = gloriaFoodFetcher.fetchMenu();
            validate(snapshot);

            run.advance(SyncPhase.RECONCILING);
            Long menuId = ensureMenu(snapshot);

            MenuSyncResult result = menuRebuilder.rebuild(menuId, snapshot, run);
            run.advance(SyncPhase.DONE);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("trigger", trigger.name());
            payload.put("stats", result);
            eventLogService.success(EventType.MENU_SYNC, payload);
            return result;
        } catch (RuntimeException e) {
            run.advance(SyncPhase.FAILED);
            BusinessException failure = asBusinessException(e);
            log.error("Menu sync [{}] failed: {}", trigger, failure.getMessage(), e);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("trigger", trigger.name());
            payload.put("error", failure.getMessage());
            eventLogService.error(EventType.MENU_SYNC, payload, failure.getMessage());
            throw failure;
        }
    }

    private void validate(MenuSnapshot snapshot) {
        if (snapshot.id() == null) {
            throw new BusinessException(ErrorCode.INVALID_MENU_SNAPSHOT, "Menu snapshot has no id");
        }
    }

    private Long ensureMenu(MenuSnapshot snapshot) {
        try {
            return menuRegistrar.ensureMenu(snapshot);
        } catch (DataIntegrityViolationException race) {
            log.info("Menu row created concurrently, reusing it: externalId={}", snapshot.id());
            return menuRepository.findByExternalId(snapshot.id())
                    .orElseThrow(() -> new BusinessException(ErrorCode.PERSISTENCE_FAILED,
                            "Menu row vanished after concurrent insert: " + snapshot.id(), race))
                    .getId();
        }
    }

    // 예상 못 한 예외는 "Menu sync failed: ..."로 감싼다
    private BusinessException asBusinessException(RuntimeException e) {
        if (e instanceof BusinessException businessException) {
            return businessException;
        }
        return new BusinessException(ErrorCode.PERSISTENCE_FAILED, "Menu sync failed: " + e.getMessage(), e);
    }
}
