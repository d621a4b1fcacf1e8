/*
 * どこで: Message サービス層
 * 何を: ユーザ全体/アプリケーション単位のメッセージ一覧を返す
 * なぜ: 認可チェックとページ計算を一覧 API から一箇所で呼び出すため
 */
package com.example.push.message.service;

import com.example.push.message.api.request.PagingRequest;
import com.example.push.message.model.PagingResult;
import com.example.push.message.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageQueryService {

  private final MessageRepository messageRepository;
  private final MessageAccessGuard accessGuard;
  private final MessagePagingService pagingService;

  public PagingResult listForUser(long userId, PagingRequest paging) {
    return pagingService.buildPage(
        paging, (limit, since) -> messageRepository.findByUserSince(userId, limit, since));
  }

  public PagingResult listForApplication(long userId, long applicationId, PagingRequest paging) {
    accessGuard.requireOwnedApplication(userId, applicationId);
    return pagingService.buildPage(
        paging,
        (limit, since) -> messageRepository.findByApplicationSince(applicationId, limit, since));
  }
}
