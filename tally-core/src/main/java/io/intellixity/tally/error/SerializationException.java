package io.intellixity.tally.error;

/** Malformed metric payload, or a field path that no longer exists in the current schema. */
public class SerializationException extends TallyException {
  public SerializationException(String message) { super(message); }
  public SerializationException(String message, Throwable cause) { super(message, cause); }
}
