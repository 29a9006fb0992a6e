/*
 * どこで: Lobby API レスポンス DTO
 * 何を: ゲームのカタログ情報とバージョン履歴を返す
 * なぜ: 最新バージョンを呼び出し側で判定させず、追記順の最後を明示するため
 */
package com.example.lobby.api.response;

import com.example.lobby.model.GameRecord;
import com.example.lobby.model.VersionRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record GameResponse(
    String gameId,
    String developerId,
    String name,
    String description,
    String gameType,
    String listingState,
    String latestVersion,
    List<VersionResponse> versions,
    String createdAt,
    String delistedAt) {

  public static GameResponse from(GameRecord game) {
    return new GameResponse(
        game.gameId(),
        game.developerId(),
        game.name(),
        game.description(),
        game.gameType(),
        game.listingState().name(),
        game.latestVersion().map(VersionRecord::label).orElse(null),
        game.versions().stream().map(VersionResponse::from).toList(),
        game.createdAt().toString(),
        game.delistedAt() == null ? null : game.delistedAt().toString());
  }
}
