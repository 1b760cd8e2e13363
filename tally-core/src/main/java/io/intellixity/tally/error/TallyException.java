package io.intellixity.tally.error;

/** Root of every failure raised by the metric compiler, discovery and execution layers. */
public class TallyException extends RuntimeException {
  public TallyException(String message) { super(message); }
  public TallyException(String message, Throwable cause) { super(message, cause); }
}
