package com.copyleft.Coup.feature.game;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GameRoomLockFacadeTest {

    private final GameRoomLockFacade lockFacade = new GameRoomLockFacade();

    @Test
    @DisplayName("락 안에서 작업을 실행하고 결과를 돌려준다")
    void execute_ReturnsResult() {
        // when
        LockResult<String> result = lockFacade.execute("ABCD", () -> "done");

        // then
        assertFalse(result.isLockFailed());
        assertEquals("done", result.data());
    }

    @Test
    @DisplayName("같은 방의 작업은 동시에 실행되지 않는다")
    void execute_SameRoom_Serialized() throws InterruptedException {
        // given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicInteger running = new AtomicInteger();
        List<Integer> observed = Collections.synchronizedList(new ArrayList<>());

        // when
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    lockFacade.execute("ABCD", () -> {
                        observed.add(running.incrementAndGet());
                        running.decrementAndGet();
                    });
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertEquals(threads, observed.size());
        observed.forEach(n -> assertEquals(1, n));
    }

    @Test
    @DisplayName("작업 중 예외는 그대로 던지고 락은 풀린다")
    void execute_Exception_Propagates() {
        // when
        assertThrows(IllegalStateException.class, () -> lockFacade.execute("ABCD", (Runnable) () -> {
            throw new IllegalStateException("boom");
        }));

        // then
        assertFalse(lockFacade.execute("ABCD", () -> "again").isLockFailed());
    }

    @Test
    @DisplayName("재시도 대기 중에 락이 정리되어도 같은 방 작업이 겹치지 않는다")
    void forget_WhileWaiterSleeps_StillSerialized() throws InterruptedException {
        // given
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch firstEntered = new CountDownLatch(1);
        AtomicReference<LockResult<Void>> waiterResult = new AtomicReference<>();
        AtomicReference<LockResult<Void>> lateResult = new AtomicReference<>();

        Thread holder = new Thread(() -> lockFacade.execute("ABCD", () -> {
            firstEntered.countDown();
            occupy(inside, maxInside, 2100);
        }));
        // 첫 시도는 시간 초과로 실패하고 잠깐 쉰 뒤 다시 시도한다
        Thread waiter = new Thread(() -> waiterResult.set(
                lockFacade.execute("ABCD", () -> occupy(inside, maxInside, 500))));

        // when
        holder.start();
        assertTrue(firstEntered.await(5, TimeUnit.SECONDS));
        waiter.start();

        holder.join();
        lockFacade.forget("ABCD");
        Thread late = new Thread(() -> lateResult.set(
                lockFacade.execute("ABCD", () -> occupy(inside, maxInside, 600))));
        late.start();

        waiter.join(10_000);
        late.join(10_000);

        // then
        assertEquals(1, maxInside.get());
        assertFalse(waiterResult.get().isLockFailed());
        assertFalse(lateResult.get().isLockFailed());
    }

    @Test
    @DisplayName("작업 중인 락은 정리하지 않는다")
    void forget_InsideAction_KeepsLock() {
        // when
        LockResult<Boolean> result = lockFacade.execute("ABCD", () -> {
            lockFacade.forget("ABCD");
            return lockFacade.execute("ABCD", () -> true).data();
        });

        // then
        assertTrue(result.data());
    }

    private static void occupy(AtomicInteger inside, AtomicInteger maxInside, long millis) {
        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            inside.decrementAndGet();
        }
    }
}
