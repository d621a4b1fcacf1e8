/*
 * どこで: Message 通知層
 * 何を: メッセージイベントをユーザ単位の NATS subject へ publish する
 * なぜ: ライブ接続を保持するゲートウェイへファンアウトを委ねるため
 */
package com.example.push.message.notifier;

import com.example.push.common.TraceIds;
import com.example.push.message.config.MessageNatsProperties;
import com.example.push.message.model.MessageEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Connection/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NatsMessageEventNotifier implements MessageEventNotifier {

  private static final Logger logger = LoggerFactory.getLogger(NatsMessageEventNotifier.class);
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final Connection connection;
  private final MessageNatsProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void notifyUser(long userId, MessageEvent event) {
    final String eventId = UUID.randomUUID().toString();
    final String traceId = TraceIds.currentOrNew();
    final MessageEventPayload payload = MessageEventPayload.of(eventId, userId, traceId, event);
    final Headers headers = new Headers();
    headers.add(HEADER_EVENT_TYPE, payload.type());
    headers.add(HEADER_TRACE_ID, traceId);
    final String subject = properties.subjectFor(userId);
    // core NATS の publish はバッファ投入で返るため、リクエストスレッドをブロックしない
    connection.publish(subject, headers, serialize(payload));
    logger.debug(
        "message event published subject={} type={} messages={}",
        subject,
        payload.type(),
        payload.messages().size());
  }

  private byte[] serialize(MessageEventPayload payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("message event serialization failure", ex);
    }
  }
}
