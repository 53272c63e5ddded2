package com.example.dispatch.model;

public enum DeliveryStatus {
  SUCCESS,
  RETRYABLE_ERROR,
  PERMANENT_ERROR
}
