/*
 * どこで: Lobby サービス層
 * 何を: エンティティ (ルーム/ゲーム/評価ペア) 単位の排他ロックを提供する
 * なぜ: 同一エンティティへの操作だけを直列化し、別エンティティの操作は並行に進めるため
 */
package com.example.lobby.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class EntityLocks {

  public static final String SCOPE_GAME = "game";
  public static final String SCOPE_ROOM = "room";
  public static final String SCOPE_RATING = "rating";
  public static final String SCOPE_REGISTRY = "registry";

  private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();

  /**
   * 役割: (scope, entityId) のロックを保持したまま action を実行する。
   * 動作: ロックは利用者数で管理し、最後の利用者が抜けた時点で表から外す。存在しない ID への操作もロックを残さない。
   */
  public <T> T withLock(String scope, String entityId, Supplier<T> action) {
    final String key = key(scope, entityId);
    // users の増減は compute 内だけで行い、同じキーの登録/削除と競合させない。
    final LockEntry entry =
        locks.compute(
            key,
            (ignored, existing) -> {
              final LockEntry current = existing == null ? new LockEntry() : existing;
              current.users++;
              return current;
            });
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(key, (ignored, current) -> --current.users == 0 ? null : current);
    }
  }

  int activeCount() {
    return locks.size();
  }

  private String key(String scope, String entityId) {
    return scope + ":" + entityId;
  }

  private static final class LockEntry {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
