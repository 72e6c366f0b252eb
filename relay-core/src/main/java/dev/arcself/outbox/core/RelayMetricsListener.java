package dev.arcself.outbox.core;

/**
 * Observes the streaming thread. Callbacks run synchronously on that thread and must not block.
 */
public interface RelayMetricsListener<E> {
  void onEventPublished(E event, String subject);
  void onDecodeFailure(String walPosition, Throwable error);
  void onStateChange(RelayStateChange stateChange);
  void onPositionAcknowledged(String slotName, String walPosition);
}
