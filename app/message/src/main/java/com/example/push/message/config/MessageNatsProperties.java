/*
 * どこで: Message アプリの設定バインド
 * 何を: メッセージイベント publish 先 subject の接頭辞を保持する
 * なぜ: ユーザ単位 subject の命名を環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.example.push.message.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "message.nats")
@Validated
public record MessageNatsProperties(@NotBlank String subjectPrefix) {

  @AssertTrue(message = "message.nats.subject-prefix must not contain wildcards or end with '.'")
  public boolean isSubjectPrefixValid() {
    // null/空は @NotBlank で検出する前提。
    if (subjectPrefix == null || subjectPrefix.isBlank()) {
      return true;
    }
    return !subjectPrefix.contains("*")
        && !subjectPrefix.contains(">")
        && !subjectPrefix.contains(" ")
        && !subjectPrefix.endsWith(".");
  }

  public String subjectFor(long userId) {
    return subjectPrefix + "." + userId;
  }
}
