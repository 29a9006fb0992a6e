/*
 * どこで: Lobby 設定
 * 何を: アップロードされたアーカイブの保存先を保持する
 * なぜ: 実行環境ごとにディスク配置を切り替えるため
 */
package com.example.lobby.config;

import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lobby.storage")
public record LobbyStorageProperties(@NotNull Path blobRoot) {}
