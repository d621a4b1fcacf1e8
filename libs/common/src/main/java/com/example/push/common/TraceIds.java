/*
 * どこで: 共通ユーティリティ
 * 何を: ログ/イベントに載せる trace_id を解決する
 * なぜ: リクエスト起点のログと通知イベントを同じキーで突き合わせるため
 */
package com.example.push.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC に trace_id (旧形式 traceId を含む) があればそれを、無ければ新規 ID を返す。 */
  public static String currentOrNew() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get("traceId");
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
