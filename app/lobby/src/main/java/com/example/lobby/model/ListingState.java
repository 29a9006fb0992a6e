/*
 * どこで: Lobby ドメインモデル
 * 何を: カタログ上の掲載状態を定義する
 * なぜ: 下架してもバージョン履歴と既存ルームを残すため (削除ではなく状態遷移)
 */
package com.example.lobby.model;

public enum ListingState {
  LISTED,
  DELISTED
}
