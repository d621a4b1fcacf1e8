/*
 * どこで: Message 通知層
 * 何を: 配信イベントのワイヤ形式 (JSON) を定義する
 * なぜ: 購読側が作成/削除を type で判別できるようにするため
 */
package com.example.push.message.notifier;

import com.example.push.message.api.response.MessageResponse;
import com.example.push.message.model.MessageEvent;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageEventPayload(
    String eventId, String type, long userId, String traceId, List<MessageResponse> messages) {

  public MessageEventPayload {
    messages = List.copyOf(messages);
  }

  public static MessageEventPayload of(
      String eventId, long userId, String traceId, MessageEvent event) {
    return new MessageEventPayload(
        eventId,
        event.type().value(),
        userId,
        traceId,
        event.messages().stream().map(MessageResponse::from).toList());
  }
}
