/*
 * どこで: Message アプリのインフラ設定
 * 何を: 通知 publish 用の NATS Connection を Spring 管理下に置く
 * なぜ: NATS 停止中もリクエストを止めず、再接続後に送信を再開させるため
 */
package com.example.push.message.config;

import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  // 再接続は無制限。publish は再接続バッファに積まれる
  private static final int UNLIMITED_RECONNECTS = -1;

  @Bean(destroyMethod = "close")
  public Connection natsConnection(
      NatsProperties properties, @Value("${spring.application.name:message}") String appName)
      throws IOException, InterruptedException {
    return Nats.connect(buildOptions(properties, appName));
  }

  @VisibleForTesting
  static Options buildOptions(NatsProperties properties, String appName) {
    return new Options.Builder()
        .server(properties.url())
        .connectionName(appName + "-notifier")
        .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
        .maxReconnects(UNLIMITED_RECONNECTS)
        .reconnectWait(Duration.ofSeconds(properties.reconnectWait()))
        .reconnectBufferSize(properties.reconnectBufferBytes())
        .connectionListener(connectionStateLogger())
        .build();
  }

  private static ConnectionListener connectionStateLogger() {
    return (connection, event) -> {
      if (event == ConnectionListener.Events.DISCONNECTED
          || event == ConnectionListener.Events.CLOSED) {
        logger.warn("nats connection state changed event={}", event);
        return;
      }
      logger.info("nats connection state changed event={}", event);
    };
  }
}
