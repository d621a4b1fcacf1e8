/*
 * どこで: Message ドメインモデル
 * 何を: messages テーブルのスナップショット
 * なぜ: ページング/削除イベント/API 応答で同じ値を共有するため
 */
package com.example.push.message.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MessageRecord(
    long id,
    long applicationId,
    String title,
    String message,
    Integer priority,
    Map<String, Object> extras,
    Instant date) {

  public MessageRecord {
    // SpotBugs の EI_EXPOSE_REP 対応: extras は防御的コピーして不変化する
    if (extras != null) {
      extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }
  }
}
