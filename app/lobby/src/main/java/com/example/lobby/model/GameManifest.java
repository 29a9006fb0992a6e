/*
 * どこで: Lobby ドメインモデル
 * 何を: バージョンごとの manifest (入口/サーバ入口/人数上下限) を表現する
 * なぜ: 取り込み時に一度だけ検証し、以降は型付きで参照するため
 */
package com.example.lobby.model;

public record GameManifest(String entry, String serverEntry, int minPlayers, int maxPlayers) {

  public boolean hasServerEntry() {
    return serverEntry != null && !serverEntry.isBlank();
  }

  public boolean hasEntry() {
    return entry != null && !entry.isBlank();
  }

  public boolean admits(int rosterSize) {
    return rosterSize >= minPlayers && rosterSize <= maxPlayers;
  }
}
