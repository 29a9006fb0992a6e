package com.example.lobby.api;

import com.example.lobby.api.request.SubmitRatingRequest;
import com.example.lobby.api.response.RatingResponse;
import com.example.lobby.api.response.RatingSummaryResponse;
import com.example.lobby.service.RatingLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/games/{gameId}/ratings")
@RequiredArgsConstructor
public class RatingController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final RatingLedger ratingLedger;

  @PostMapping
  public ResponseEntity<RatingResponse> submitRating(
      @PathVariable("gameId") String gameId,
      @RequestHeader(HEADER_USER_ID) String playerId,
      @Valid @RequestBody SubmitRatingRequest request) {
    return ResponseEntity.ok(
        RatingResponse.from(
            ratingLedger.submit(playerId, gameId, request.score(), request.comment())));
  }

  @GetMapping
  public ResponseEntity<RatingSummaryResponse> getRatings(@PathVariable("gameId") String gameId) {
    return ResponseEntity.ok(
        RatingSummaryResponse.from(
            ratingLedger.aggregate(gameId), ratingLedger.ratingsFor(gameId)));
  }
}
