package com.example.lobby.api.response;

import com.example.lobby.model.PlayRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayRecordResponse(String gameId, long playCount, String lastStartedAt) {

  public static PlayRecordResponse from(PlayRecord record) {
    return new PlayRecordResponse(
        record.gameId(),
        record.playCount(),
        record.lastStartedAt() == null ? null : record.lastStartedAt().toString());
  }
}
