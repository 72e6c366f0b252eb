package dev.arcself.outbox.core;

public enum RelayState {
  CREATED,
  STARTING,
  ATTACHED,
  STREAMING,
  SHUTTING_DOWN,
  FAULTED,
  CLOSED
}
