/*
 * どこで: Message メトリクステスト
 * 何を: 作成/削除/通知失敗メトリクスが記録されることを検証する
 * なぜ: ベストエフォート通知の失敗計測が回帰しないようにするため
 */
package com.example.push.message.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.push.message.model.MessageEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MessageMetricsTest {

  @Test
  void recordsCreatedDeletedAndNotifyFailures() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MessageMetrics metrics = new MessageMetrics(registry);

    metrics.recordCreated();
    metrics.recordDeleted(DeletionScope.APPLICATION, 3);
    metrics.recordDeleted(DeletionScope.APPLICATION, 0);
    metrics.recordNotifyFailure(MessageEventType.MESSAGES_DELETED);

    assertThat(registry.get("message.created.total").counter().count()).isEqualTo(1.0d);
    assertThat(
            registry.get("message.deleted.total").tag("scope", "application").counter().count())
        .isEqualTo(3.0d);
    assertThat(
            registry
                .get("message.notify.failures.total")
                .tag("type", "messages_deleted")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
