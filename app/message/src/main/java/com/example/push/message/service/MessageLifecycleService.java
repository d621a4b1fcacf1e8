/*
 * どこで: Message サービス層
 * 何を: メッセージの作成/削除と、それに対応するライブリスナー通知を順序付けて実行する
 * なぜ: 未保存メッセージの通知や、削除後に内容を失った通知を防ぐため
 */
package com.example.push.message.service;

import com.example.push.message.api.InvalidApplicationTokenException;
import com.example.push.message.api.InvalidMessageRequestException;
import com.example.push.message.api.request.CreateMessageRequest;
import com.example.push.message.model.ApplicationRecord;
import com.example.push.message.model.MessageCreatedEvent;
import com.example.push.message.model.MessageEvent;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.model.MessagesDeletedEvent;
import com.example.push.message.model.NewMessage;
import com.example.push.message.notifier.MessageEventNotifier;
import com.example.push.message.repository.MessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * メッセージのライフサイクル操作。
 *
 * <p>作成は「保存 → 通知」、削除は「スナップショット取得 → 通知 → 削除」の順で実行する。通知失敗は操作失敗として扱わない。
 *
 * <p>create をトランザクションで囲まないこと。通知はコミット済みの行に対してのみ送る。
 */
@Service
@RequiredArgsConstructor
public class MessageLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(MessageLifecycleService.class);

  private final MessageRepository messageRepository;
  private final MessageAccessGuard accessGuard;
  private final MessageEventNotifier notifier;
  private final MessageMetrics metrics;
  private final Clock clock;

  public MessageRecord create(String applicationToken, CreateMessageRequest request) {
    validateCreateRequest(request);
    final ApplicationRecord application = resolveApplication(applicationToken);
    NewMessage message =
        new NewMessage(
            application.id(),
            request.title(),
            request.message(),
            request.priority(),
            request.extras(),
            Instant.now(clock));
    if (message.title() == null || message.title().isBlank()) {
      message = message.withTitle(application.name());
    }
    // 保存に失敗した場合はここで例外が伝播し、通知は送らない
    final MessageRecord stored = messageRepository.create(message);
    metrics.recordCreated();
    publish(application.userId(), new MessageCreatedEvent(stored));
    return stored;
  }

  public void deleteMessage(long userId, long messageId) {
    final MessageRecord message = accessGuard.requireOwnedMessage(userId, messageId);
    publish(userId, new MessagesDeletedEvent(List.of(message)));
    deleteAfterNotify(
        DeletionScope.MESSAGE, messageId, 1, () -> messageRepository.deleteMessageById(messageId));
  }

  public void deleteAllForApplication(long userId, long applicationId) {
    accessGuard.requireOwnedApplication(userId, applicationId);
    final List<MessageRecord> snapshot = messageRepository.findByApplication(applicationId);
    publish(userId, new MessagesDeletedEvent(snapshot));
    deleteAfterNotify(
        DeletionScope.APPLICATION,
        applicationId,
        snapshot.size(),
        () -> messageRepository.deleteByApplication(applicationId));
  }

  public void deleteAllForUser(long userId) {
    final List<MessageRecord> snapshot = messageRepository.findByUser(userId);
    publish(userId, new MessagesDeletedEvent(snapshot));
    deleteAfterNotify(
        DeletionScope.USER,
        userId,
        snapshot.size(),
        () -> messageRepository.deleteByUser(userId));
  }

  private void validateCreateRequest(CreateMessageRequest request) {
    if (request == null) {
      throw new InvalidMessageRequestException("request body is required");
    }
    if (request.message() == null || request.message().isBlank()) {
      throw new InvalidMessageRequestException("message is required");
    }
  }

  private ApplicationRecord resolveApplication(String applicationToken) {
    if (applicationToken == null || applicationToken.isBlank()) {
      throw new InvalidApplicationTokenException();
    }
    return messageRepository
        .findApplicationByToken(applicationToken)
        .orElseThrow(InvalidApplicationTokenException::new);
  }

  private void publish(long userId, MessageEvent event) {
    try {
      notifier.notifyUser(userId, event);
    } catch (RuntimeException ex) {
      // 通知はベストエフォート。保存/削除の結果には影響させない
      metrics.recordNotifyFailure(event.type());
      logger.warn(
          "message event notification failed userId={} type={} messages={}",
          userId,
          event.type().value(),
          event.messages().size(),
          ex);
    }
  }

  private void deleteAfterNotify(
      DeletionScope scope, long targetId, int messageCount, Runnable deletion) {
    try {
      deletion.run();
    } catch (DataAccessException ex) {
      // 通知は取り消せないため、失敗はログに残して呼び出し元へ返す
      logger.warn(
          "message deletion failed after notification scope={} targetId={}",
          scope.value(),
          targetId,
          ex);
      throw ex;
    }
    metrics.recordDeleted(scope, messageCount);
  }
}
