/*
 * どこで: Lobby 設定
 * 何を: ルームイベントの publish 先 subject と JetStream stream 設定を保持する
 * なぜ: publish と重複排除の前提となる stream を環境で揃えるため
 */
package com.example.lobby.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lobby.nats")
public record LobbyNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {}
