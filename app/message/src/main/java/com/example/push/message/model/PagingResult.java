/*
 * どこで: Message ドメインモデル
 * 何を: 1 ページ分のメッセージと次カーソルを保持する
 * なぜ: ページ計算結果を HTTP 表現から切り離すため
 */
package com.example.push.message.model;

import java.util.List;

/**
 * ページング結果。
 *
 * <p>{@code nextSince} は次ページが存在する場合のみ非 null で、{@code since} と同じ値になる。次ページが無い場合
 * {@code since} は 0。
 */
public record PagingResult(
    List<MessageRecord> messages, int size, int limit, long since, Long nextSince) {

  public PagingResult {
    messages = List.copyOf(messages);
  }

  public static PagingResult lastPage(List<MessageRecord> messages, int limit) {
    return new PagingResult(messages, messages.size(), limit, 0L, null);
  }

  public static PagingResult withNext(List<MessageRecord> messages, int limit, long nextSince) {
    return new PagingResult(messages, messages.size(), limit, nextSince, nextSince);
  }

  public boolean hasNext() {
    return nextSince != null;
  }
}
