/*
 * どこで: Lobby サービス層
 * 何を: 評価の登録 (upsert) と集計を扱う
 * なぜ: 起動記録のあるプレイヤーだけが、(player, game) ごとに 1 件だけ評価できるようにするため
 */
package com.example.lobby.service;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.InvalidLobbyRequestException;
import com.example.lobby.api.LobbyConflictException;
import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.config.LobbyRatingProperties;
import com.example.lobby.model.AccountRole;
import com.example.lobby.model.RatingRecord;
import com.example.lobby.model.RatingSummary;
import com.example.lobby.repository.GameCatalogRepository;
import com.example.lobby.repository.RatingRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RatingLedger {

  private static final Logger logger = LoggerFactory.getLogger(RatingLedger.class);

  private final RatingRepository ratingRepository;
  private final GameCatalogRepository gameCatalogRepository;
  private final PlayEligibilityTracker playEligibilityTracker;
  private final AccountDirectory accountDirectory;
  private final LobbyRatingProperties properties;
  private final LobbyMetrics metrics;
  private final EntityLocks entityLocks;
  private final Clock clock;

  /**
   * 役割: 評価を登録する。
   * 動作: スコア範囲 → ゲーム存在 → 評価資格の順に検査し、(player, game) の既存評価を上書きする。
   * 前提: 下架済みのゲームでも資格があれば評価できる。
   */
  public RatingRecord submit(String playerId, String gameId, int score, String comment) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    if (score < properties.minScore() || score > properties.maxScore()) {
      metrics.recordRatingSubmit("invalid");
      throw new InvalidLobbyRequestException(
          ApiErrorCode.INVALID_SCORE,
          gameId,
          "score must be between " + properties.minScore() + " and " + properties.maxScore());
    }
    if (comment != null && comment.length() > properties.maxCommentLength()) {
      metrics.recordRatingSubmit("invalid");
      throw new InvalidLobbyRequestException(
          ApiErrorCode.BAD_REQUEST,
          gameId,
          "comment must be at most " + properties.maxCommentLength() + " characters");
    }
    if (gameCatalogRepository.findById(gameId).isEmpty()) {
      throw LobbyNotFoundException.game(gameId);
    }
    if (!playEligibilityTracker.isEligible(playerId, gameId)) {
      metrics.recordRatingSubmit("not_eligible");
      throw new LobbyConflictException(
          ApiErrorCode.NOT_ELIGIBLE,
          gameId,
          "player " + playerId + " has not played " + gameId);
    }
    final RatingRecord rating =
        new RatingRecord(playerId, gameId, score, comment, Instant.now(clock));
    final Optional<RatingRecord> previous =
        entityLocks.withLock(
            EntityLocks.SCOPE_RATING, gameId + "|" + playerId, () -> ratingRepository.upsert(rating));
    metrics.recordRatingSubmit(previous.isPresent() ? "updated" : "created");
    logger.info(
        "rating submitted gameId={} playerId={} score={} replaced={}",
        gameId,
        playerId,
        score,
        previous.isPresent());
    return rating;
  }

  public RatingSummary aggregate(String gameId) {
    requireGame(gameId);
    return RatingSummary.of(gameId, ratingRepository.findByGame(gameId));
  }

  public List<RatingRecord> ratingsFor(String gameId) {
    requireGame(gameId);
    return ratingRepository.findByGame(gameId);
  }

  private void requireGame(String gameId) {
    if (gameCatalogRepository.findById(gameId).isEmpty()) {
      throw LobbyNotFoundException.game(gameId);
    }
  }
}
