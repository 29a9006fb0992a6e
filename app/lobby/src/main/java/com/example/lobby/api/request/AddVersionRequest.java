/*
 * どこで: Lobby API リクエスト DTO
 * 何を: バージョン追加 API の入力 (ラベル/アーカイブ/manifest) を定義する
 * なぜ: アーカイブを base64 の JSON フィールドとして受け取るため
 */
package com.example.lobby.api.request;

import com.example.lobby.api.InvalidLobbyRequestException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Base64;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AddVersionRequest(
    @NotBlank @Size(max = 64) String version,
    @Size(max = 2000) String notes,
    @NotBlank String fileData,
    @NotNull @Valid ManifestPayload manifest) {

  public byte[] decodeFileData() {
    try {
      return Base64.getDecoder().decode(fileData);
    } catch (IllegalArgumentException ex) {
      throw new InvalidLobbyRequestException("file_data must be base64");
    }
  }
}
