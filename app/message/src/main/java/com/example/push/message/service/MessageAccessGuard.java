/*
 * どこで: Message サービス層
 * 何を: アプリケーション/メッセージが操作ユーザの所有かを検証する
 * なぜ: 読み取り/変更の前に所有者チェーン (message -> application -> user) を解決するため
 */
package com.example.push.message.service;

import com.example.push.message.api.ApplicationNotFoundException;
import com.example.push.message.api.MessageNotFoundException;
import com.example.push.message.model.ApplicationRecord;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageAccessGuard {

  private final MessageRepository messageRepository;

  /**
   * 役割: 操作ユーザが所有するアプリケーションを返す。 動作: 不存在と他ユーザ所有はどちらも ApplicationNotFoundException。
   */
  public ApplicationRecord requireOwnedApplication(long userId, long applicationId) {
    return messageRepository
        .findApplicationById(applicationId)
        .filter(application -> application.isOwnedBy(userId))
        .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
  }

  /**
   * 役割: 操作ユーザが所有するメッセージを返す。 動作: メッセージ/アプリケーションの不存在、他ユーザ所有はいずれも
   * MessageNotFoundException。
   */
  public MessageRecord requireOwnedMessage(long userId, long messageId) {
    final MessageRecord message =
        messageRepository
            .findMessageById(messageId)
            .orElseThrow(() -> new MessageNotFoundException(messageId));
    final boolean owned =
        messageRepository
            .findApplicationById(message.applicationId())
            .map(application -> application.isOwnedBy(userId))
            .orElse(false);
    if (!owned) {
      throw new MessageNotFoundException(messageId);
    }
    return message;
  }
}
