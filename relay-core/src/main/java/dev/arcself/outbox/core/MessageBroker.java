package dev.arcself.outbox.core;

import java.util.Collection;

/**
 * The slice of a message broker the relay needs.
 */
public interface MessageBroker extends AutoCloseable {

  /**
   * Ensures every subject exists before the first publish. Must be idempotent.
   */
  void provision(Collection<String> subjects) throws Exception;

  /**
   * Publishes one message and returns once the broker has acknowledged it.
   *
   * @param key ordering key, may be {@code null}
   */
  void publish(String subject, String key, byte[] payload) throws Exception;

  @Override
  void close();
}
