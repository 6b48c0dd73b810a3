package com.foodsync.menu.service;

/**
 * FETCHING → RECONCILING → REBUILDING → FINALIZING → DONE.
 * 어느 단계에서든 FAILED로 갈 수 있다.
 */
public enum SyncPhase {
    FETCHING,
    RECONCILING,
    REBUILDING,
    FINALIZING,
    DONE,
    FAILED
}
