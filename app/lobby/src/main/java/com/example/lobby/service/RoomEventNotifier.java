package com.example.lobby.service;

import com.example.lobby.model.RoomRecord;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ルーム状態の確定後にイベントを送る。publish の失敗はログとメトリクスに残し、状態遷移そのものは取り消さない。
 */
@Component
@RequiredArgsConstructor
public class RoomEventNotifier {

  private static final Logger logger = LoggerFactory.getLogger(RoomEventNotifier.class);

  private final LobbyEventPublisher publisher;
  private final LobbyMetrics metrics;

  public void roomStarted(RoomRecord room) {
    publishQuietly(LobbyEventPublisher.EVENT_ROOM_STARTED, room);
  }

  public void roomClosed(RoomRecord room) {
    publishQuietly(LobbyEventPublisher.EVENT_ROOM_CLOSED, room);
  }

  private void publishQuietly(String eventType, RoomRecord room) {
    try {
      publisher.publish(eventType, room);
    } catch (RuntimeException ex) {
      logger.warn("room event publish failed eventType={} roomId={}", eventType, room.roomId(), ex);
      metrics.recordDependencyError("event_publish");
    }
  }
}
