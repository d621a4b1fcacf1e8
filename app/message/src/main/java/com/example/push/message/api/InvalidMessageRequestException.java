/*
 * どこで: Message API
 * 何を: ページング/作成リクエストの妥当性エラーを表現する
 * なぜ: ストレージや通知に触れる前に 400 へ正規化するため
 */
package com.example.push.message.api;

public class InvalidMessageRequestException extends RuntimeException {
  public InvalidMessageRequestException(String message) {
    super(message);
  }
}
