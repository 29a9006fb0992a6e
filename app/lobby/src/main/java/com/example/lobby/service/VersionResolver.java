/*
 * どこで: Lobby サービス層
 * 何を: (gameId, 任意のラベル) を具体的なバージョンへ解決する
 * なぜ: ラベル省略時は「最後に追加されたバージョン」とする規則を 1 か所に集約するため
 */
package com.example.lobby.service;

import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.model.GameRecord;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.repository.GameCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VersionResolver {

  static final String LATEST = "latest";

  private final GameCatalogRepository gameCatalogRepository;

  /**
   * 役割: バージョンを解決する。
   * 動作: label が null/空なら最新、指定があれば完全一致。掲載状態は見ない。
   * 前提: 読み取りのみで状態を変更しない。
   */
  public VersionRecord resolve(String gameId, String label) {
    final GameRecord game =
        gameCatalogRepository
            .findById(gameId)
            .orElseThrow(() -> LobbyNotFoundException.game(gameId));
    return resolve(game, label);
  }

  public VersionRecord resolve(GameRecord game, String label) {
    if (label == null || label.isBlank()) {
      return game.latestVersion()
          .orElseThrow(() -> LobbyNotFoundException.version(game.gameId(), LATEST));
    }
    return game.findVersion(label)
        .orElseThrow(() -> LobbyNotFoundException.version(game.gameId(), label));
  }
}
