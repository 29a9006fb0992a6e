package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void orNewKeepsProvidedTraceId() {
    assertThat(TraceIds.orNew("trace-1")).isEqualTo("trace-1");
  }

  @Test
  void orNewGeneratesWhenBlank() {
    assertThat(TraceIds.orNew(" ")).isNotBlank().isNotEqualTo(TraceIds.orNew(null));
  }
}
