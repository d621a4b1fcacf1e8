/*
 * どこで: Message API レスポンス DTO
 * 何を: メッセージの外部表現を定義する
 * なぜ: API 応答と通知ペイロードで同じ JSON 形状を使うため
 */
package com.example.push.message.api.response;

import com.example.push.message.model.MessageRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "extras は MessageRecord 側で不変化済みの Map をそのまま返すため")
public record MessageResponse(
    long id,
    @JsonProperty("appid") long applicationId,
    String title,
    String message,
    Integer priority,
    Map<String, Object> extras,
    String date) {

  public static MessageResponse from(MessageRecord record) {
    return new MessageResponse(
        record.id(),
        record.applicationId(),
        record.title(),
        record.message(),
        record.priority(),
        record.extras(),
        record.date() == null ? null : record.date().toString());
  }
}
