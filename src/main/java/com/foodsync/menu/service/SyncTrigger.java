package com.foodsync.menu.service;

public enum SyncTrigger {
    MANUAL,
    SCHEDULED
}
