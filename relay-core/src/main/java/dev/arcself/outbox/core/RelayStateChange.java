package dev.arcself.outbox.core;

public final class RelayStateChange {
  private final RelayState previousState;
  private final RelayState state;
  private final Throwable cause;

  public RelayStateChange(RelayState previousState, RelayState state, Throwable cause) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
  }

  public RelayState previousState() {
    return previousState;
  }

  public RelayState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }
}
