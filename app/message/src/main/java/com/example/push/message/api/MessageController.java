/*
 * どこで: Message API
 * 何を: メッセージの一覧/削除/作成エンドポイントを公開する
 * なぜ: ユーザ/アプリケーションからの要求をサービス層へ橋渡しするため
 */
package com.example.push.message.api;

import com.example.push.message.api.request.CreateMessageRequest;
import com.example.push.message.api.request.PagingRequest;
import com.example.push.message.api.response.MessageResponse;
import com.example.push.message.api.response.PagedMessagesResponse;
import com.example.push.message.model.PagingResult;
import com.example.push.message.service.MessageLifecycleService;
import com.example.push.message.service.MessageQueryService;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequiredArgsConstructor
public class MessageController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String HEADER_APPLICATION_TOKEN = "X-Application-Token";
  private static final String PARAM_LIMIT = "limit";
  private static final String PARAM_SINCE = "since";
  private static final String DEFAULT_LIMIT = "100";
  private static final String DEFAULT_SINCE = "0";

  private final MessageQueryService queryService;
  private final MessageLifecycleService lifecycleService;

  @GetMapping("/message")
  public PagedMessagesResponse getMessages(
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestParam(value = PARAM_LIMIT, defaultValue = DEFAULT_LIMIT) int limit,
      @RequestParam(value = PARAM_SINCE, defaultValue = DEFAULT_SINCE) long since) {
    final PagingRequest paging = new PagingRequest(limit, since);
    return toPagedResponse(queryService.listForUser(userId, paging));
  }

  @GetMapping("/application/{id}/message")
  public PagedMessagesResponse getApplicationMessages(
      @PathVariable("id") long applicationId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestParam(value = PARAM_LIMIT, defaultValue = DEFAULT_LIMIT) int limit,
      @RequestParam(value = PARAM_SINCE, defaultValue = DEFAULT_SINCE) long since) {
    final PagingRequest paging = new PagingRequest(limit, since);
    return toPagedResponse(queryService.listForApplication(userId, applicationId, paging));
  }

  @DeleteMapping("/message")
  public ResponseEntity<Void> deleteMessages(@RequestHeader(HEADER_USER_ID) long userId) {
    lifecycleService.deleteAllForUser(userId);
    return ResponseEntity.ok().build();
  }

  @DeleteMapping("/application/{id}/message")
  public ResponseEntity<Void> deleteApplicationMessages(
      @PathVariable("id") long applicationId, @RequestHeader(HEADER_USER_ID) long userId) {
    lifecycleService.deleteAllForApplication(userId, applicationId);
    return ResponseEntity.ok().build();
  }

  @DeleteMapping("/message/{id}")
  public ResponseEntity<Void> deleteMessage(
      @PathVariable("id") long messageId, @RequestHeader(HEADER_USER_ID) long userId) {
    lifecycleService.deleteMessage(userId, messageId);
    return ResponseEntity.ok().build();
  }

  @PostMapping("/message")
  public MessageResponse createMessage(
      @RequestHeader(value = HEADER_APPLICATION_TOKEN, required = false) String headerToken,
      @RequestParam(value = "token", required = false) String queryToken,
      @Valid @RequestBody CreateMessageRequest request) {
    return MessageResponse.from(
        lifecycleService.create(resolveToken(headerToken, queryToken), request));
  }

  @VisibleForTesting
  static String resolveToken(String headerToken, String queryToken) {
    // ヘッダ指定を優先し、空の場合のみクエリ指定を使う
    if (headerToken != null && !headerToken.isBlank()) {
      return headerToken;
    }
    return queryToken;
  }

  private PagedMessagesResponse toPagedResponse(PagingResult result) {
    final String next = result.hasNext() ? buildNextUrl(result) : null;
    return PagedMessagesResponse.from(result, next);
  }

  private String buildNextUrl(PagingResult result) {
    // 現在のリクエスト URL を複製し、limit/since だけを差し替える
    return ServletUriComponentsBuilder.fromCurrentRequest()
        .replaceQueryParam(PARAM_LIMIT, result.limit())
        .replaceQueryParam(PARAM_SINCE, result.nextSince())
        .build()
        .toUriString();
  }
}
