/*
 * どこで: Lobby API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: 種別と対象エンティティ ID をクライアントへ必ず返すため
 */
package com.example.lobby.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message, String entityId) {}
