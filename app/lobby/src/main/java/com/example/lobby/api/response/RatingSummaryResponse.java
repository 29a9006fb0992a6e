package com.example.lobby.api.response;

import com.example.lobby.model.RatingRecord;
import com.example.lobby.model.RatingSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record RatingSummaryResponse(
    String gameId, int count, double mean, List<RatingResponse> ratings) {

  public static RatingSummaryResponse from(RatingSummary summary, List<RatingRecord> ratings) {
    return new RatingSummaryResponse(
        summary.gameId(),
        summary.count(),
        summary.mean(),
        ratings.stream().map(RatingResponse::from).toList());
  }
}
