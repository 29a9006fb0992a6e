/*
 * どこで: Lobby 設定
 * 何を: ルームイベント publish 用の NATS 接続設定を保持する
 * なぜ: publish の有効/無効や接続先を環境で切り替えるため
 */
package com.example.lobby.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Duration connectionTimeout, String connectionName) {

  private static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(2);

  public NatsProperties {
    if (connectionTimeout == null) {
      connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    }
    if (connectionName == null || connectionName.isBlank()) {
      connectionName = "lobby";
    }
  }
}
