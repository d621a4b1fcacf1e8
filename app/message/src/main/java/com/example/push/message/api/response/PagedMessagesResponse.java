/*
 * どこで: Message API レスポンス DTO
 * 何を: ページング付きメッセージ一覧の応答を定義する
 * なぜ: クライアントが next をそのまま辿れる形に固定するため
 */
package com.example.push.message.api.response;

import com.example.push.message.model.PagingResult;
import java.util.List;

public record PagedMessagesResponse(List<MessageResponse> messages, PagingResponse paging) {

  public PagedMessagesResponse {
    messages = List.copyOf(messages);
  }

  public static PagedMessagesResponse from(PagingResult result, String nextUrl) {
    return new PagedMessagesResponse(
        result.messages().stream().map(MessageResponse::from).toList(),
        new PagingResponse(result.size(), result.limit(), result.since(), nextUrl));
  }
}
