package com.copyleft.Coup.feature.game;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 방 단위 직렬화. 같은 방의 요청은 하나씩 처리하고, 다른 방끼리는 서로 기다리지 않는다.
 */
@Slf4j
@Component
public class GameRoomLockFacade {

    private static final long WAIT_TIME_MS = 2000L;  // 락 대기 최대 시간
    private static final int MAX_RETRY = 3;          // 최대 3번 재시도
    private static final long RETRY_DELAY_MS = 300L; // 재시도 사이 0.3초 휴식

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public LockResult<Void> execute(String roomCode, Runnable action) {
        return executeInternal(roomCode, () -> {
            action.run();
            return null;
        });
    }

    public <T> LockResult<T> execute(String roomCode, Supplier<T> action) {
        return executeInternal(roomCode, action);
    }

    /**
     * 방이 사라졌을 때 락을 정리한다. 락을 직접 쥔 상태에서만 지우고, 누가 쓰고 있으면 남겨 둔다.
     * 대기 중이던 스레드는 락을 얻은 뒤 맵에서 빠진 락임을 알아채고 새 락으로 다시 시도한다.
     */
    public void forget(String roomCode) {
        ReentrantLock lock = locks.get(roomCode);
        if (lock == null || !lock.tryLock()) return;
        try {
            // 같은 스레드가 작업 중에 부른 경우는 지우지 않는다
            if (lock.getHoldCount() == 1) {
                locks.remove(roomCode, lock);
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> LockResult<T> executeInternal(String roomCode, Supplier<T> action) {
        // 최대 N번 반복 시도
        int attempt = 0;
        while (attempt < MAX_RETRY) {
            ReentrantLock lock = locks.computeIfAbsent(roomCode, key -> new ReentrantLock());
            try {
                boolean available = lock.tryLock(WAIT_TIME_MS, TimeUnit.MILLISECONDS);

                if (available) {
                    try {
                        // 기다리는 사이 정리된 락이면 지금 맵에 있는 락으로 다시 잡는다
                        if (locks.get(roomCode) != lock) {
                            continue;
                        }
                        return LockResult.success(action.get());
                    } finally {
                        lock.unlock();
                    }
                }

                attempt++;
                log.warn("락 획득 실패, 재시도 대기중 ({}/{}): roomCode={}", attempt, MAX_RETRY, roomCode);
                try {
                    Thread.sleep(RETRY_DELAY_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return LockResult.lockFailed();
                }

            } catch (InterruptedException e) {
                log.error("락 인터럽트 발생", e);
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            } catch (RuntimeException e) {
                log.error("비즈니스 로직 오류: roomCode={}", roomCode, e);
                throw e;
            }
        }

        log.error("락 획득 최종 실패 (Timeout): roomCode={}", roomCode);
        return LockResult.lockFailed();
    }
}
