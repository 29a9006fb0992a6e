package com.example.lobby.repository;

import com.example.lobby.model.PlayRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "lobby.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryPlayRecordRepository implements PlayRecordRepository {

  private final ConcurrentMap<PlayKey, PlayRecord> records = new ConcurrentHashMap<>();

  @Override
  public PlayRecord recordStart(String playerId, String gameId, Instant startedAt) {
    // compute はキー単位で原子的なので、同一ペアの加算が失われない。
    return records.compute(
        new PlayKey(playerId, gameId),
        (key, existing) ->
            existing == null
                ? new PlayRecord(playerId, gameId, 1, startedAt)
                : new PlayRecord(playerId, gameId, existing.playCount() + 1, startedAt));
  }

  @Override
  public Optional<PlayRecord> find(String playerId, String gameId) {
    return Optional.ofNullable(records.get(new PlayKey(playerId, gameId)));
  }

  @Override
  public List<PlayRecord> findByPlayer(String playerId) {
    return records.values().stream()
        .filter(record -> record.playerId().equals(playerId))
        .sorted(Comparator.comparing(PlayRecord::gameId))
        .toList();
  }

  private record PlayKey(String playerId, String gameId) {}
}
