/*
 * どこで: common のイベント payload 定義
 * 何を: ルームのライフサイクル (起動/終了) イベントの形状を定義する
 * なぜ: publish 側と購読側で同一の JSON 形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoomEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String roomId,
    String gameId,
    String version,
    List<String> playerIds,
    String reason,
    String traceId) {

  public RoomEventPayload {
    playerIds = playerIds == null ? List.of() : List.copyOf(playerIds);
  }
}
