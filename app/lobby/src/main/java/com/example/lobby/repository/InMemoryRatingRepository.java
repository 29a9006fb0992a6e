package com.example.lobby.repository;

import com.example.lobby.model.RatingRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "lobby.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRatingRepository implements RatingRepository {

  private final ConcurrentMap<String, ConcurrentMap<String, RatingRecord>> ratingsByGame =
      new ConcurrentHashMap<>();

  @Override
  public Optional<RatingRecord> upsert(RatingRecord rating) {
    return Optional.ofNullable(
        ratingsByGame
            .computeIfAbsent(rating.gameId(), ignored -> new ConcurrentHashMap<>())
            .put(rating.playerId(), rating));
  }

  @Override
  public Optional<RatingRecord> find(String playerId, String gameId) {
    final Map<String, RatingRecord> ratings = ratingsByGame.get(gameId);
    return ratings == null ? Optional.empty() : Optional.ofNullable(ratings.get(playerId));
  }

  @Override
  public List<RatingRecord> findByGame(String gameId) {
    final Map<String, RatingRecord> ratings = ratingsByGame.get(gameId);
    if (ratings == null) {
      return List.of();
    }
    return ratings.values().stream()
        .sorted(Comparator.comparing(RatingRecord::ratedAt).reversed())
        .toList();
  }
}
