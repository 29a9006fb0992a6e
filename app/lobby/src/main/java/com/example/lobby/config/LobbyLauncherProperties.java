/*
 * どこで: Lobby 設定
 * 何を: game server 起動 (展開先/公開ホスト/インタプリタ/待機時間) の設定を保持する
 * なぜ: ローカル検証と本番ホストで起動方法を切り替えるため
 */
package com.example.lobby.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lobby.launcher")
public record LobbyLauncherProperties(
    @NotNull Path workRoot,
    @NotBlank String publicHost,
    @NotBlank String bindHost,
    String interpreter,
    @NotNull Duration readyTimeout) {}
