/*
 * どこで: Lobby ドメインモデル
 * 何を: ゲームのカタログエントリと追記専用のバージョン履歴を表現する
 * なぜ: 更新はロック内で新しいレコードへ差し替え、読み取り側はスナップショットを扱えるようにするため
 */
package com.example.lobby.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record GameRecord(
    String gameId,
    String developerId,
    String name,
    String description,
    String gameType,
    ListingState listingState,
    List<VersionRecord> versions,
    Instant createdAt,
    Instant delistedAt) {

  public GameRecord {
    versions = versions == null ? List.of() : List.copyOf(versions);
  }

  public boolean isListed() {
    return listingState == ListingState.LISTED;
  }

  public boolean isOwnedBy(String developerId) {
    return this.developerId.equals(developerId);
  }

  /** 追記順で最後のバージョン。ラベルの大小では判定しない。 */
  public Optional<VersionRecord> latestVersion() {
    if (versions.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(versions.get(versions.size() - 1));
  }

  public Optional<VersionRecord> findVersion(String label) {
    return versions.stream().filter(v -> v.label().equals(label)).findFirst();
  }

  public GameRecord withVersionAppended(VersionRecord version) {
    final List<VersionRecord> appended = new ArrayList<>(versions);
    appended.add(version);
    return new GameRecord(
        gameId,
        developerId,
        name,
        description,
        gameType,
        listingState,
        appended,
        createdAt,
        delistedAt);
  }

  public GameRecord delisted(Instant at) {
    return new GameRecord(
        gameId, developerId, name, description, gameType, ListingState.DELISTED, versions, createdAt, at);
  }
}
