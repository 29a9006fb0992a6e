/*
 * どこで: Lobby ドメインモデル
 * 何を: ゲーム単位の評価集計 (件数/平均) を表現する
 * なぜ: 読み取り時に都度計算した結果を API へ渡すため
 */
package com.example.lobby.model;

import java.util.Collection;

public record RatingSummary(String gameId, int count, double mean) {

  public static RatingSummary of(String gameId, Collection<RatingRecord> ratings) {
    if (ratings.isEmpty()) {
      return new RatingSummary(gameId, 0, 0.0);
    }
    final double mean = ratings.stream().mapToInt(RatingRecord::score).average().orElse(0.0);
    return new RatingSummary(gameId, ratings.size(), mean);
  }
}
