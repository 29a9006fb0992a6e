package com.example.lobby.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.lobby.model.PlayRecord;
import com.example.lobby.repository.InMemoryPlayRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PlayEligibilityTrackerTest {

  private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
  private final PlayEligibilityTracker tracker =
      new PlayEligibilityTracker(new InMemoryPlayRecordRepository(), clock);

  @Test
  void unknownPairIsNotEligible() {
    assertThat(tracker.isEligible("alice", "chess")).isFalse();
    assertThat(tracker.playsOf("alice")).isEmpty();
  }

  @Test
  void markStartedIncrementsPerPair() {
    tracker.markStarted("alice", "chess");
    final PlayRecord second = tracker.markStarted("alice", "chess");
    tracker.markStarted("alice", "go");

    assertThat(second.playCount()).isEqualTo(2);
    assertThat(second.lastStartedAt()).isEqualTo(clock.instant());
    assertThat(tracker.isEligible("alice", "chess")).isTrue();
    assertThat(tracker.isEligible("bob", "chess")).isFalse();
    assertThat(tracker.playsOf("alice"))
        .extracting(PlayRecord::gameId, PlayRecord::playCount)
        .containsExactly(
            org.assertj.core.groups.Tuple.tuple("chess", 2L),
            org.assertj.core.groups.Tuple.tuple("go", 1L));
  }
}
