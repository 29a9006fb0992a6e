/*
 * どこで: Lobby サービス層
 * 何を: (player, game) ごとの起動記録を管理し、評価資格を判定する
 * なぜ: 「実際に起動されたルームに参加した」事実だけを評価資格の根拠にするため
 */
package com.example.lobby.service;

import com.example.lobby.model.PlayRecord;
import com.example.lobby.repository.PlayRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PlayEligibilityTracker {

  private final PlayRecordRepository playRecordRepository;
  private final Clock clock;

  /** 役割: 起動記録を 1 回分進める。 前提: ルームの起動が成功した後にのみ呼ぶこと。 */
  public PlayRecord markStarted(String playerId, String gameId) {
    return playRecordRepository.recordStart(playerId, gameId, Instant.now(clock));
  }

  public boolean isEligible(String playerId, String gameId) {
    return playRecordRepository.find(playerId, gameId).map(PlayRecord::hasStarted).orElse(false);
  }

  public List<PlayRecord> playsOf(String playerId) {
    return playRecordRepository.findByPlayer(playerId);
  }
}
