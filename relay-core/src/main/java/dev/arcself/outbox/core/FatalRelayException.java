package dev.arcself.outbox.core;

/**
 * A failure that ends the relay session. The process is expected to exit and be restarted by its
 * supervisor, which resumes from the last acknowledged position.
 */
public class FatalRelayException extends IllegalStateException {

  public FatalRelayException(String message) {
    super(message);
  }

  public FatalRelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
