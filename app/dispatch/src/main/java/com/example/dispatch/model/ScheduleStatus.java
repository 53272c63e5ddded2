package com.example.dispatch.model;

public enum ScheduleStatus {
  ACTIVE,
  RETIRED,
  CANCELLED
}
