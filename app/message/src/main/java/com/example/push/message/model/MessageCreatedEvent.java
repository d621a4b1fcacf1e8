package com.example.push.message.model;

import java.util.List;
import java.util.Objects;

public record MessageCreatedEvent(MessageRecord message) implements MessageEvent {

  public MessageCreatedEvent {
    Objects.requireNonNull(message, "message");
  }

  @Override
  public MessageEventType type() {
    return MessageEventType.MESSAGE_CREATED;
  }

  @Override
  public List<MessageRecord> messages() {
    return List.of(message);
  }
}
