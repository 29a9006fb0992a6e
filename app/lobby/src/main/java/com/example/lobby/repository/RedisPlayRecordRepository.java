package com.example.lobby.repository;

import com.example.lobby.model.PlayRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "lobby.store", havingValue = "redis")
public class RedisPlayRecordRepository implements PlayRecordRepository {

  private static final String SUFFIX_LAST_STARTED_AT = ":last_started_at";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisPlayRecordRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public PlayRecord recordStart(String playerId, String gameId, Instant startedAt) {
    final HashOperations<String, Object, Object> hashOps = redisTemplate.opsForHash();
    final String key = playKey(playerId);
    // HINCRBY はキー単位で原子的なので、複数インスタンスからの加算でも取りこぼさない。
    final Long count = hashOps.increment(key, gameId, 1L);
    hashOps.put(key, gameId + SUFFIX_LAST_STARTED_AT, startedAt.toString());
    return new PlayRecord(playerId, gameId, count == null ? 1L : count, startedAt);
  }

  @Override
  public Optional<PlayRecord> find(String playerId, String gameId) {
    final HashOperations<String, Object, Object> hashOps = redisTemplate.opsForHash();
    final Object count = hashOps.get(playKey(playerId), gameId);
    if (count == null) {
      return Optional.empty();
    }
    final Object lastStartedAt = hashOps.get(playKey(playerId), gameId + SUFFIX_LAST_STARTED_AT);
    return Optional.of(
        new PlayRecord(
            playerId, gameId, Long.parseLong(String.valueOf(count)), parseInstant(lastStartedAt)));
  }

  @Override
  public List<PlayRecord> findByPlayer(String playerId) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(playKey(playerId));
    final List<PlayRecord> records = new ArrayList<>();
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      final String field = String.valueOf(e.getKey());
      if (field.endsWith(SUFFIX_LAST_STARTED_AT)) {
        continue;
      }
      records.add(
          new PlayRecord(
              playerId,
              field,
              Long.parseLong(String.valueOf(e.getValue())),
              parseInstant(raw.get(field + SUFFIX_LAST_STARTED_AT))));
    }
    records.sort(Comparator.comparing(PlayRecord::gameId));
    return records;
  }

  static String playKey(String playerId) {
    return "lobby:play:" + playerId;
  }

  private Instant parseInstant(Object value) {
    return value == null || String.valueOf(value).isBlank()
        ? null
        : Instant.parse(String.valueOf(value));
  }
}
