package com.example.lobby.api.response;

import com.example.lobby.model.RoomRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record RoomResponse(
    String roomId,
    String gameId,
    String version,
    String hostPlayerId,
    List<String> players,
    int minPlayers,
    int maxPlayers,
    String status,
    ConnectionResponse connection,
    String createdAt,
    String startedAt,
    String closedAt,
    String closedReason) {

  public static RoomResponse from(RoomRecord room) {
    return new RoomResponse(
        room.roomId(),
        room.gameId(),
        room.version().label(),
        room.hostPlayerId(),
        room.roster(),
        room.manifest().minPlayers(),
        room.manifest().maxPlayers(),
        room.status().name(),
        ConnectionResponse.from(room.connection()),
        format(room.createdAt()),
        format(room.startedAt()),
        format(room.closedAt()),
        room.closedReason());
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
