/*
 * どこで: Message ドメインモデル
 * 何を: 1 回の削除操作で消えるメッセージ一覧
 * なぜ: 削除後は取得できないため、削除前のスナップショットを通知に載せるため
 */
package com.example.push.message.model;

import java.util.List;

public record MessagesDeletedEvent(List<MessageRecord> messages) implements MessageEvent {

  public MessagesDeletedEvent {
    messages = List.copyOf(messages);
  }

  @Override
  public MessageEventType type() {
    return MessageEventType.MESSAGES_DELETED;
  }
}
