package com.example.push.message.api;

public class ApplicationNotFoundException extends ResourceNotFoundException {
  public ApplicationNotFoundException(long applicationId) {
    super("application does not exist", applicationId);
  }
}
