package com.example.lobby.service;

import com.example.common.TraceIds;
import com.example.common.event.RoomEventPayload;
import com.example.lobby.config.LobbyNatsProperties;
import com.example.lobby.model.RoomRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JetStreamLobbyEventPublisher implements LobbyEventPublisher {

  private final JetStream jetStream;
  private final LobbyNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JetStreamLobbyEventPublisher(
      JetStream jetStream, LobbyNatsProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void publish(String eventType, RoomRecord room) {
    if (room == null || room.roomId() == null || room.roomId().isBlank()) {
      throw new IllegalArgumentException("roomId is required");
    }
    final String eventId = UUID.randomUUID().toString();
    final RoomEventPayload payload =
        new RoomEventPayload(
            eventId,
            eventType,
            Instant.now(clock).toString(),
            room.roomId(),
            room.gameId(),
            room.version().label(),
            room.roster(),
            room.closedReason(),
            TraceIds.orNew(MDC.get("request_id")));
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    headers.add("event_type", eventType);
    try {
      jetStream.publish(properties.subject(), headers, objectMapper.writeValueAsBytes(payload));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize room event", ex);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish room event", ex);
    }
  }
}
