/*
 * どこで: Message サービス層
 * 何を: 作成件数/削除件数/通知失敗件数のアプリ固有メトリクスを記録する
 * なぜ: ベストエフォート通知の失敗を Prometheus から観測できるようにするため
 */
package com.example.push.message.service;

import com.example.push.message.model.MessageEventType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MessageMetrics {

  private static final String METRIC_CREATED_TOTAL = "message.created.total";
  private static final String METRIC_DELETED_TOTAL = "message.deleted.total";
  private static final String METRIC_NOTIFY_FAILURES_TOTAL = "message.notify.failures.total";

  private final MeterRegistry meterRegistry;
  private final Counter createdCounter;
  private final ConcurrentMap<DeletionScope, Counter> deletedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MessageEventType, Counter> notifyFailureCounters =
      new ConcurrentHashMap<>();

  public MessageMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.createdCounter =
        Counter.builder(METRIC_CREATED_TOTAL)
            .description("Total number of stored messages")
            .register(meterRegistry);
  }

  public void recordCreated() {
    createdCounter.increment();
  }

  public void recordDeleted(DeletionScope scope, int messageCount) {
    if (messageCount <= 0) {
      return;
    }
    deletedCounters
        .computeIfAbsent(
            scope,
            ignored ->
                Counter.builder(METRIC_DELETED_TOTAL)
                    .description("Total number of deleted messages")
                    .tags(Tags.of("scope", scope.value()))
                    .register(meterRegistry))
        .increment(messageCount);
  }

  public void recordNotifyFailure(MessageEventType type) {
    notifyFailureCounters
        .computeIfAbsent(
            type,
            ignored ->
                Counter.builder(METRIC_NOTIFY_FAILURES_TOTAL)
                    .description("Message event notifications that failed to reach listeners")
                    .tags(Tags.of("type", type.value()))
                    .register(meterRegistry))
        .increment();
  }
}
