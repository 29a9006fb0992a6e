package com.example.lobby.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.LobbyNotFoundException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntityLocksTest {

  @TempDir Path tempDir;

  @Test
  void operationsOnUnknownRoomsLeaveNoLockBehind() {
    final LobbyFixture fixture = new LobbyFixture(tempDir);

    for (int i = 0; i < 100; i++) {
      final String roomId = "missing-" + i;
      assertThatThrownBy(() -> fixture.rooms.joinRoom(roomId, "alice"))
          .isInstanceOf(LobbyNotFoundException.class)
          .extracting("code")
          .isEqualTo(ApiErrorCode.ROOM_NOT_FOUND);
      assertThatThrownBy(() -> fixture.launcher.start(roomId, "alice"))
          .isInstanceOf(LobbyNotFoundException.class);
    }

    assertThat(fixture.locks.activeCount()).isZero();
  }

  @Test
  void nestedLockOnSameEntityIsReleasedOnce() {
    final EntityLocks locks = new EntityLocks();

    final String result =
        locks.withLock(
            EntityLocks.SCOPE_ROOM,
            "1",
            () -> locks.withLock(EntityLocks.SCOPE_ROOM, "1", () -> "inner"));

    assertThat(result).isEqualTo("inner");
    assertThat(locks.activeCount()).isZero();
  }

  @Test
  void contendedLockSerializesAndIsRemovedAfterLastUser() throws Exception {
    final EntityLocks locks = new EntityLocks();
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final CountDownLatch ready = new CountDownLatch(1);
    final AtomicInteger inside = new AtomicInteger();
    final AtomicInteger maxInside = new AtomicInteger();
    try {
      final List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        futures.add(
            executor.submit(
                () -> {
                  ready.await();
                  return locks.withLock(
                      EntityLocks.SCOPE_GAME,
                      "chess",
                      () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        return inside.decrementAndGet();
                      });
                }));
      }
      ready.countDown();
      for (Future<Integer> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(locks.activeCount()).isZero();
  }
}
