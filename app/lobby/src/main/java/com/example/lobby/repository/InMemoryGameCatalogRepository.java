package com.example.lobby.repository;

import com.example.lobby.model.GameRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryGameCatalogRepository implements GameCatalogRepository {

  private final ConcurrentMap<String, GameRecord> games = new ConcurrentHashMap<>();

  @Override
  public Optional<GameRecord> findById(String gameId) {
    return Optional.ofNullable(games.get(gameId));
  }

  @Override
  public List<GameRecord> findAll() {
    final List<GameRecord> all = new ArrayList<>(games.values());
    all.sort(Comparator.comparing(GameRecord::createdAt).thenComparing(GameRecord::gameId));
    return all;
  }

  @Override
  public boolean insertIfAbsent(GameRecord record) {
    return games.putIfAbsent(record.gameId(), record) == null;
  }

  @Override
  public void save(GameRecord record) {
    games.put(record.gameId(), record);
  }
}
