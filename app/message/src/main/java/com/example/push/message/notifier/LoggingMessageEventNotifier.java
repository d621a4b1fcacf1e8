/*
 * どこで: Message 通知層
 * 何を: NATS 無効時にイベントをログへ記録するだけの実装
 * なぜ: ローカル起動やテストで NATS なしでもライフサイクル処理を動かすため
 */
package com.example.push.message.notifier;

import com.example.push.message.model.MessageEvent;
import com.example.push.message.model.MessageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingMessageEventNotifier implements MessageEventNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingMessageEventNotifier.class);

  @Override
  public void notifyUser(long userId, MessageEvent event) {
    logger.info(
        "message event simulated userId={} type={} messageIds={}",
        userId,
        event.type().value(),
        event.messages().stream().map(MessageRecord::id).toList());
  }
}
