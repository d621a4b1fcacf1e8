/*
 * どこで: Message ドメインモデル
 * 何を: ライブリスナーへ届けるイベントの共通型
 * なぜ: 作成/削除で異なるペイロードを型で区別するため
 */
package com.example.push.message.model;

import java.util.List;

public sealed interface MessageEvent permits MessageCreatedEvent, MessagesDeletedEvent {

  MessageEventType type();

  /** イベントが参照するメッセージ。作成なら 1 件、削除なら削除対象全件。 */
  List<MessageRecord> messages();
}
