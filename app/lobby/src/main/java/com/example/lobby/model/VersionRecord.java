/*
 * どこで: Lobby ドメインモデル
 * 何を: 不変のゲームバージョン (ラベル/blob 参照/manifest) を表現する
 * なぜ: ルームが作成時点のバージョンに固定されることを型で保証するため
 */
package com.example.lobby.model;

import java.time.Instant;

public record VersionRecord(
    String versionId,
    String gameId,
    String label,
    String blobRef,
    GameManifest manifest,
    String notes,
    Instant uploadedAt) {}
