package com.example.dispatch.service;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(UUID jobId) {
    super("job not found jobId=" + jobId);
  }
}
