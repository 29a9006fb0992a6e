package com.example.lobby.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class LobbyMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer launchDurationTimer;
  private final AtomicLong openRooms = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> launchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> ratingCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public LobbyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.launchDurationTimer =
        Timer.builder("lobby.launch.duration")
            .description("Time spent in the room start critical section")
            .register(meterRegistry);
    Gauge.builder("lobby.rooms.open", openRooms, AtomicLong::get)
        .description("Rooms that are WAITING or RUNNING")
        .register(meterRegistry);
  }

  public void recordRoomTransition(String transition) {
    transitionCounters
        .computeIfAbsent(transition, t -> counter("lobby.room.transition.total", "transition", t))
        .increment();
  }

  public void recordLaunch(String result) {
    launchCounters.computeIfAbsent(result, r -> counter("lobby.launch.total", "result", r)).increment();
  }

  public void recordLaunchDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    launchDurationTimer.record(duration);
  }

  public void recordRatingSubmit(String result) {
    ratingCounters
        .computeIfAbsent(result, r -> counter("lobby.rating.submit.total", "result", r))
        .increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, t -> counter("lobby.dependency.error.total", "type", t))
        .increment();
  }

  public void updateOpenRooms(long count) {
    openRooms.set(Math.max(0, count));
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
