package com.example.lobby.service;

import com.example.lobby.model.RoomRecord;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingEventPublisher implements LobbyEventPublisher {

  final List<String> published = new CopyOnWriteArrayList<>();
  volatile boolean failing;

  @Override
  public void publish(String eventType, RoomRecord room) {
    if (failing) {
      throw new IllegalStateException("failed to publish room event");
    }
    published.add(eventType + ":" + room.roomId());
  }
}
