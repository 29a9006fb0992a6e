package com.example.lobby.repository;

import com.example.lobby.model.RoomRecord;
import com.example.lobby.model.RoomStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRoomRepository implements RoomRepository {

  private final AtomicLong sequence = new AtomicLong(0);
  private final ConcurrentMap<String, RoomRecord> rooms = new ConcurrentHashMap<>();

  @Override
  public String nextRoomId() {
    return Long.toString(sequence.incrementAndGet());
  }

  @Override
  public Optional<RoomRecord> findById(String roomId) {
    return Optional.ofNullable(rooms.get(roomId));
  }

  @Override
  public List<RoomRecord> findAll() {
    final List<RoomRecord> all = new ArrayList<>(rooms.values());
    all.sort(Comparator.comparingLong(room -> Long.parseLong(room.roomId())));
    return all;
  }

  @Override
  public void save(RoomRecord room) {
    rooms.put(room.roomId(), room);
  }

  @Override
  public List<String> deleteClosedBefore(Instant cutoff) {
    final List<String> removed = new ArrayList<>();
    for (RoomRecord room : rooms.values()) {
      if (room.status() == RoomStatus.CLOSED
          && room.closedAt() != null
          && room.closedAt().isBefore(cutoff)
          && rooms.remove(room.roomId(), room)) {
        removed.add(room.roomId());
      }
    }
    return removed;
  }
}
