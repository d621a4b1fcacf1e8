/*
 * どこで: Message ドメインモデル
 * 何を: 採番前の作成対象メッセージ
 * なぜ: ID をストレージ側で採番させ、作成前後の型を区別するため
 */
package com.example.push.message.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NewMessage(
    long applicationId,
    String title,
    String message,
    Integer priority,
    Map<String, Object> extras,
    Instant date) {

  public NewMessage {
    if (extras != null) {
      extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }
  }

  public NewMessage withTitle(String newTitle) {
    return new NewMessage(applicationId, newTitle, message, priority, extras, date);
  }

  public MessageRecord toRecord(long id) {
    return new MessageRecord(id, applicationId, title, message, priority, extras, date);
  }
}
