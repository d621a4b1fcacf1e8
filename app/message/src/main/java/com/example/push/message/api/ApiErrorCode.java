/*
 * どこで: Message API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.push.message.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  NOT_FOUND,
  STORAGE_ERROR,
  INTERNAL_ERROR
}
