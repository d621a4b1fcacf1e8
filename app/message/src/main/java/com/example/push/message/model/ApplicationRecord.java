/*
 * どこで: Message ドメインモデル
 * 何を: applications テーブルのスナップショット
 * なぜ: メッセージの所有者解決とトークン認証に使うため
 */
package com.example.push.message.model;

public record ApplicationRecord(
    long id, long userId, String token, String name, String description) {

  public boolean isOwnedBy(long candidateUserId) {
    return userId == candidateUserId;
  }
}
