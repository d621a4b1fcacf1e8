/*
 * どこで: Common 共通設定
 * 何を: マイクロ秒精度に丸めた UTC の Clock を DI 可能にする
 * なぜ: 作成直後に返す時刻と PostgreSQL (timestamptz) から読み戻す時刻を一致させるため
 */
package com.example.push.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  static final Duration STORAGE_PRECISION = Duration.ofNanos(1_000);

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), STORAGE_PRECISION);
  }
}
