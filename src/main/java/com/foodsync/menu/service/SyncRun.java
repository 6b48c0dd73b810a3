package com.foodsync.menu.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * 동기화 호출 한 번의 상태 (단계, 기한). 호출이 끝나면 버려진다.
 */
@Slf4j
@Getter
public class SyncRun {

    private final SyncTrigger trigger;
    private final Instant deadline;
    private SyncPhase phase = SyncPhase.FETCHING;

    public SyncRun(SyncTrigger trigger, Instant deadline) {
        this.trigger = trigger;
        this.deadline = deadline;
        log.info("Menu sync [{}] started: phase={}", trigger, phase);
    }

    public void advance(SyncPhase next) {
        log.info("Menu sync [{}] phase {} -> {}", trigger, phase, next);
        this.phase = next;
    }

    public boolean isExpired() {
        return Instant.now().isAfter(deadline);
    }
}
