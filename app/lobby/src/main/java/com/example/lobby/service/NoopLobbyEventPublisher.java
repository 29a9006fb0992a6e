/*
 * どこで: Lobby サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル起動やテストで NATS なしでもルーム操作を動かすため
 */
package com.example.lobby.service;

import com.example.lobby.model.RoomRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false", matchIfMissing = true)
public class NoopLobbyEventPublisher implements LobbyEventPublisher {

  @Override
  public void publish(String eventType, RoomRecord room) {
    // no-op
  }
}
