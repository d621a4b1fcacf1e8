/*
 * どこで: Message ドメインモデル
 * 何を: 通知イベントの種別を表す列挙
 * なぜ: Notifier 側の分岐を switch で網羅的に書けるようにするため
 */
package com.example.push.message.model;

public enum MessageEventType {
  MESSAGE_CREATED("message_created"),
  MESSAGES_DELETED("messages_deleted");

  private final String value;

  MessageEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
