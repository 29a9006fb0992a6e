package com.example.lobby.repository;

import com.example.lobby.model.RatingRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "lobby.store", havingValue = "redis")
public class RedisRatingRepository implements RatingRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RedisRatingRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<RatingRecord> upsert(RatingRecord rating) {
    final Optional<RatingRecord> previous = find(rating.playerId(), rating.gameId());
    // HSET は field 単位の上書きなので (player, game) ごとに常に 1 件となる。
    redisTemplate.opsForHash().put(ratingKey(rating.gameId()), rating.playerId(), toJson(rating));
    return previous;
  }

  @Override
  public Optional<RatingRecord> find(String playerId, String gameId) {
    final Object raw = redisTemplate.opsForHash().get(ratingKey(gameId), playerId);
    return raw == null ? Optional.empty() : Optional.of(fromJson(String.valueOf(raw)));
  }

  @Override
  public List<RatingRecord> findByGame(String gameId) {
    final List<Object> values = redisTemplate.opsForHash().values(ratingKey(gameId));
    final List<RatingRecord> ratings = new ArrayList<>();
    if (values != null) {
      for (Object value : values) {
        ratings.add(fromJson(String.valueOf(value)));
      }
    }
    ratings.sort(Comparator.comparing(RatingRecord::ratedAt).reversed());
    return ratings;
  }

  static String ratingKey(String gameId) {
    return "lobby:ratings:" + gameId;
  }

  private String toJson(RatingRecord rating) {
    try {
      return objectMapper.writeValueAsString(rating);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize rating", ex);
    }
  }

  private RatingRecord fromJson(String json) {
    try {
      return objectMapper.readValue(json, RatingRecord.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse rating", ex);
    }
  }
}
