package com.orbit.pipeline.application.runtime;

import java.time.Instant;

/**
 * 예약된 백그라운드 작업 정보.
 *
 * @param key 작업 키 (키당 하나만 대기)
 * @param scheduledAt 예약 시각
 * @param dueAt 실행 예정 시각
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record BackgroundTask(String key, Instant scheduledAt, Instant dueAt) {

    public BackgroundTask {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (scheduledAt == null || dueAt == null) {
            throw new IllegalArgumentException("scheduledAt and dueAt cannot be null");
        }
    }
}
