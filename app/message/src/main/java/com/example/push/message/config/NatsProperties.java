/*
 * どこで: Message アプリの設定バインド
 * 何を: NATS 接続設定をプロパティから読み込む
 * なぜ: 環境ごとの接続先、再接続中の送信バッファ、通知経路の有効/無効を切り替えるため
 */
package com.example.push.message.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * NATS 接続設定。
 *
 * <p>reconnectBufferBytes を超えると publish が IllegalStateException を投げる。通知はベストエフォートのため、
 * その場合は通知失敗として記録される。
 */
@ConfigurationProperties(prefix = "nats")
@Validated
public record NatsProperties(
    boolean enabled,
    @NotBlank String url,
    @Positive Integer connectionTimeout,
    @Positive Integer reconnectWait,
    @Positive Long reconnectBufferBytes) {}
