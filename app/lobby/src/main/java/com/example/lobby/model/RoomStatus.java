/*
 * どこで: Lobby ドメインモデル
 * 何を: ルームの状態 (WAITING → RUNNING → CLOSED) を定義する
 * なぜ: CLOSED からの遷移を禁止する状態機械を列挙型で固定するため
 */
package com.example.lobby.model;

public enum RoomStatus {
  WAITING,
  RUNNING,
  CLOSED
}
