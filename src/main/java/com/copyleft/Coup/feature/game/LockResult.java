package com.copyleft.Coup.feature.game;

/**
 * 방 락 안에서 실행한 결과. 락을 얻지 못했으면 작업은 실행되지 않았다.
 */
public record LockResult<T>(T data, boolean acquired) {

    public static <T> LockResult<T> success(T data) {
        return new LockResult<>(data, true);
    }

    public static <T> LockResult<T> lockFailed() {
        return new LockResult<>(null, false);
    }

    public boolean isLockFailed() {
        return !acquired;
    }
}
