package io.intellixity.tally.error;

/** A table or source definition is missing a required column or is inconsistent. */
public class SchemaException extends TallyException {
  public SchemaException(String message) { super(message); }
  public SchemaException(String message, Throwable cause) { super(message, cause); }
}
