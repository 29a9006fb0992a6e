/*
 * どこで: Lobby API レスポンス DTO
 * 何を: バージョンのファイルごとの SHA-256 を返す
 * なぜ: クライアントがダウンロード済みファイルの改ざんを自分で検証できるようにするため
 */
package com.example.lobby.api.response;

import com.example.lobby.model.VersionIntegrity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record IntegrityResponse(String gameId, String version, Map<String, String> files) {

  public static IntegrityResponse from(VersionIntegrity integrity) {
    return new IntegrityResponse(integrity.gameId(), integrity.version(), integrity.files());
  }
}
