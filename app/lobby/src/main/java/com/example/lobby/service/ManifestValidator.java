/*
 * どこで: Lobby サービス層
 * 何を: バージョン取り込み時に manifest を検証・正規化する
 * なぜ: 不正な manifest を起動時ではなく add_version の時点で弾くため
 */
package com.example.lobby.service;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.InvalidLobbyRequestException;
import com.example.lobby.model.GameManifest;
import com.example.lobby.runtime.ArchiveInspector;
import java.util.Arrays;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ManifestValidator {

  /**
   * 役割: manifest を検証し、パス表記を正規化したコピーを返す。
   * 動作: entry 必須、server_entry は任意。どちらも相対パスで ".." を含まないこと。人数は 1 <= min <= max。
   * 前提: gameId はエラー応答の entity_id に使う。
   */
  public GameManifest validate(String gameId, GameManifest manifest) {
    if (manifest == null) {
      throw invalid(gameId, "manifest is required");
    }
    final String entry = ArchiveInspector.normalizePath(manifest.entry());
    if (entry.isEmpty()) {
      throw invalid(gameId, "entry is required");
    }
    requireSafe(gameId, "entry", entry);
    String serverEntry = null;
    if (manifest.serverEntry() != null && !manifest.serverEntry().isBlank()) {
      serverEntry = ArchiveInspector.normalizePath(manifest.serverEntry());
      if (serverEntry.isEmpty()) {
        throw invalid(gameId, "server_entry must not be blank");
      }
      requireSafe(gameId, "server_entry", serverEntry);
    }
    if (manifest.minPlayers() < 1) {
      throw invalid(gameId, "min_players must be positive");
    }
    if (manifest.maxPlayers() < manifest.minPlayers()) {
      throw invalid(gameId, "max_players must be >= min_players");
    }
    return new GameManifest(entry, serverEntry, manifest.minPlayers(), manifest.maxPlayers());
  }

  /**
   * 役割: 検証済み manifest の entry / server_entry がアーカイブ内に実在することを確かめる。
   * 前提: archiveFiles は ArchiveInspector で正規化済みのパス集合であること。
   */
  public void requireEntriesPresent(String gameId, GameManifest manifest, Set<String> archiveFiles) {
    if (!archiveFiles.contains(manifest.entry())) {
      throw invalid(gameId, "entry not found in archive: " + manifest.entry());
    }
    if (manifest.hasServerEntry() && !archiveFiles.contains(manifest.serverEntry())) {
      throw invalid(gameId, "server_entry not found in archive: " + manifest.serverEntry());
    }
  }

  private void requireSafe(String gameId, String field, String path) {
    if (Arrays.asList(path.split("/")).contains("..")) {
      throw invalid(gameId, field + " must not contain '..'");
    }
  }

  private InvalidLobbyRequestException invalid(String gameId, String message) {
    return new InvalidLobbyRequestException(ApiErrorCode.INVALID_MANIFEST, gameId, message);
  }
}
