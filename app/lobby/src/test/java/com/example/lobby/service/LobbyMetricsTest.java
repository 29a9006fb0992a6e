package com.example.lobby.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LobbyMetricsTest {

  @Test
  void recordsCountersGaugeAndTimer() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final LobbyMetrics metrics = new LobbyMetrics(registry);

    metrics.recordRoomTransition("started");
    metrics.recordRoomTransition("started");
    metrics.recordLaunch("failed");
    metrics.recordRatingSubmit("created");
    metrics.recordDependencyError("event_publish");
    metrics.recordLaunchDuration(Duration.ofMillis(120));
    metrics.updateOpenRooms(3);

    assertThat(
            registry.get("lobby.room.transition.total").tag("transition", "started").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("lobby.launch.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("lobby.rating.submit.total").tag("result", "created").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("lobby.dependency.error.total").tag("type", "event_publish").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("lobby.launch.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("lobby.rooms.open").gauge().value()).isEqualTo(3.0);
  }

  @Test
  void ignoresNegativeDurationAndClampsGauge() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final LobbyMetrics metrics = new LobbyMetrics(registry);

    metrics.recordLaunchDuration(Duration.ofMillis(-1));
    metrics.updateOpenRooms(-4);

    assertThat(registry.get("lobby.launch.duration").timer().count()).isZero();
    assertThat(registry.get("lobby.rooms.open").gauge().value()).isZero();
  }
}
