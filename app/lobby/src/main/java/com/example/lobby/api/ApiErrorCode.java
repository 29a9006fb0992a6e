/*
 * どこで: Lobby API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでもクライアントが原因ごとにメッセージを出し分けられるようにするため
 */
package com.example.lobby.api;

public enum ApiErrorCode {
  GAME_NOT_FOUND,
  VERSION_NOT_FOUND,
  ROOM_NOT_FOUND,
  NOT_OWNER,
  NOT_AUTHORIZED,
  ROOM_FULL,
  ROOM_CLOSED,
  ROOM_NOT_WAITING,
  INSUFFICIENT_PLAYERS,
  ALREADY_JOINED,
  DUPLICATE_VERSION,
  DUPLICATE_GAME,
  GAME_DELISTED,
  GAME_NOT_PLAYABLE,
  ROOM_LIMIT_REACHED,
  NOT_ELIGIBLE,
  INVALID_SCORE,
  INVALID_MANIFEST,
  INVALID_ARCHIVE,
  LAUNCH_FAILED,
  UPLOAD_FAILED,
  BAD_REQUEST,
  VALIDATION_ERROR,
  INTERNAL_ERROR
}
