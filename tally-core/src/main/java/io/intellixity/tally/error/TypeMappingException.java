package io.intellixity.tally.error;

/** A native column type could not be mapped to a {@link io.intellixity.tally.model.DataType}. */
public class TypeMappingException extends TallyException {
  public TypeMappingException(String message) { super(message); }
  public TypeMappingException(String message, Throwable cause) { super(message, cause); }
}
