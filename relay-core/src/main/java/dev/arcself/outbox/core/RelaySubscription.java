package dev.arcself.outbox.core;

@FunctionalInterface
public interface RelaySubscription {
  void cancel();
}
