package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 呼び出し元から trace_id が渡らなかった場合だけ新規採番する。 */
  public static String orNew(String traceId) {
    if (traceId == null || traceId.isBlank()) {
      return newTraceId();
    }
    return traceId;
  }
}
