package com.example.lobby.api.response;

import com.example.lobby.model.RatingRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RatingResponse(
    String playerId, String gameId, int score, String comment, String ratedAt) {

  public static RatingResponse from(RatingRecord rating) {
    return new RatingResponse(
        rating.playerId(),
        rating.gameId(),
        rating.score(),
        rating.comment(),
        rating.ratedAt().toString());
  }
}
