package com.mk.fx.qa.load.contention.model;

public enum TaskStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED
}
