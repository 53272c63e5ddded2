package com.example.dispatch.model;

public enum WindowState {
  OPEN,
  FLUSHING,
  FLUSHED,
  CANCELLED
}
