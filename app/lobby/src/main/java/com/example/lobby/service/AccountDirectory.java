/*
 * どこで: Lobby サービス層
 * 何を: 認証済み ID (開発者/プレイヤー) と最終アクセス時刻を記録する
 * なぜ: 認証はゲートウェイ側の責務であり、ここでは認可に使う ID の存在とオンライン状態だけを扱うため
 */
package com.example.lobby.service;

import com.example.lobby.api.InvalidLobbyRequestException;
import com.example.lobby.config.LobbyAccountProperties;
import com.example.lobby.model.AccountRecord;
import com.example.lobby.model.AccountRole;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccountDirectory {

  private final ConcurrentMap<AccountKey, AccountRecord> accounts = new ConcurrentHashMap<>();
  private final LobbyAccountProperties properties;
  private final Clock clock;

  /**
   * 役割: 認証済み ID を指定ロールで記録し、最終アクセス時刻を更新する。
   * 動作: 初回は登録し、2 回目以降は last_seen_at のみ更新する。
   * 前提: accountId はゲートウェイで認証済みであること。空の場合は 400 とする。
   */
  public AccountRecord touch(String accountId, AccountRole role) {
    if (accountId == null || accountId.isBlank()) {
      throw new InvalidLobbyRequestException("X-User-Id is required");
    }
    final Instant now = Instant.now(clock);
    return accounts.merge(
        new AccountKey(accountId, role),
        new AccountRecord(accountId, role, now, now),
        (existing, fresh) -> existing.seenAt(now));
  }

  public List<AccountRecord> listPlayers() {
    return accounts.values().stream()
        .filter(account -> account.role() == AccountRole.PLAYER)
        .sorted(Comparator.comparing(AccountRecord::accountId))
        .toList();
  }

  public boolean isOnline(AccountRecord account) {
    final Duration sinceLastSeen = Duration.between(account.lastSeenAt(), Instant.now(clock));
    return sinceLastSeen.compareTo(properties.onlineTimeout()) <= 0;
  }

  private record AccountKey(String accountId, AccountRole role) {}
}
