/*
 * どこで: Lobby アプリのスモークテスト
 * 何を: Spring コンテキストの起動を確認する
 * なぜ: 主要な構成 (in-memory ストア/NATS 無効) が破壊されていないことを担保するため
 */
package com.example.lobby;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.lobby.repository.InMemoryPlayRecordRepository;
import com.example.lobby.repository.PlayRecordRepository;
import com.example.lobby.service.LobbyEventPublisher;
import com.example.lobby.service.NoopLobbyEventPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class LobbyApplicationTests {

  @Autowired private PlayRecordRepository playRecordRepository;
  @Autowired private LobbyEventPublisher lobbyEventPublisher;

  @Test
  void contextLoads() {
    assertThat(playRecordRepository).isInstanceOf(InMemoryPlayRecordRepository.class);
    assertThat(lobbyEventPublisher).isInstanceOf(NoopLobbyEventPublisher.class);
  }
}
