/*
 * どこで: Lobby ワーカー
 * 何を: heartbeat の途絶えたルームを閉じ、保持期間を過ぎた CLOSED ルームを定期的に削除する
 * なぜ: 応答のないルームを残さず、ルーム一覧が終了済みルームで肥大化しないようにするため
 */
package com.example.lobby.worker;

import com.example.lobby.service.LobbyMetrics;
import com.example.lobby.service.RoomService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "lobby.room.reaper-enabled", havingValue = "true", matchIfMissing = true)
public class ClosedRoomReaper {

  private static final Logger logger = LoggerFactory.getLogger(ClosedRoomReaper.class);

  private final RoomService roomService;
  private final LobbyMetrics metrics;

  @Scheduled(fixedDelayString = "${lobby.room.reaper-interval}")
  public void run() {
    // 片方の失敗でもう片方を止めない。
    try {
      roomService.closeStaleRooms();
    } catch (RuntimeException ex) {
      logger.warn("stale room sweep failed", ex);
      metrics.recordDependencyError("room_reaper");
    }
    try {
      roomService.purgeClosedRooms();
    } catch (RuntimeException ex) {
      logger.warn("closed room reaper failed", ex);
      metrics.recordDependencyError("room_reaper");
    }
  }
}
