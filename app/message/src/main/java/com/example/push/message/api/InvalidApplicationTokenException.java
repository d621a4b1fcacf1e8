/*
 * どこで: Message API
 * 何を: アプリケーショントークンが未指定/未登録であることを表現する
 * なぜ: メッセージ作成の認証失敗を 401 へ変換するため
 */
package com.example.push.message.api;

public class InvalidApplicationTokenException extends RuntimeException {
  public InvalidApplicationTokenException() {
    super("application token is invalid");
  }
}
