package com.example.dispatch.service;

import java.util.UUID;

public class DeadLetterNotFoundException extends RuntimeException {

  public DeadLetterNotFoundException(UUID jobId) {
    super("no un-replayed dead letter for jobId=" + jobId);
  }
}
