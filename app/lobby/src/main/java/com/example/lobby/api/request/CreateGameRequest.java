/*
 * どこで: Lobby API リクエスト DTO
 * 何を: ゲーム登録 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.lobby.api.request;

import com.example.lobby.model.GameMetadata;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateGameRequest(
    @NotBlank @Size(max = 100) String name, @Size(max = 2000) String description, String gameType) {

  public GameMetadata toMetadata() {
    return new GameMetadata(name, description, gameType);
  }
}
