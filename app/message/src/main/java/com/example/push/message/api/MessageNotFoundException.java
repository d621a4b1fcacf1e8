package com.example.push.message.api;

public class MessageNotFoundException extends ResourceNotFoundException {
  public MessageNotFoundException(long messageId) {
    super("message does not exist", messageId);
  }
}
