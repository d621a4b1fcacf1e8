/*
 * どこで: Message API リクエスト DTO
 * 何を: メッセージ作成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.push.message.api.request;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record CreateMessageRequest(
    String title, @NotBlank String message, Integer priority, Map<String, Object> extras) {}
