package com.example.dispatch.service;

import java.util.UUID;

public class ScheduleNotFoundException extends RuntimeException {

  public ScheduleNotFoundException(UUID specId) {
    super("active schedule not found specId=" + specId);
  }
}
