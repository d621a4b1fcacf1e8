/*
 * どこで: Message API リクエスト値
 * 何を: limit/since のページング指定を検証済みの値として保持する
 * なぜ: 範囲外の値をページ計算やストレージへ渡す前に弾くため
 */
package com.example.push.message.api.request;

import com.example.push.message.api.InvalidMessageRequestException;

public record PagingRequest(int limit, long since) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MIN_LIMIT = 1;
  public static final int MAX_LIMIT = 200;

  public PagingRequest {
    if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
      throw new InvalidMessageRequestException(
          "limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
    }
    if (since < 0) {
      throw new InvalidMessageRequestException("since must not be negative");
    }
  }

  public static PagingRequest firstPage() {
    return new PagingRequest(DEFAULT_LIMIT, 0L);
  }
}
