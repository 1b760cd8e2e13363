package io.intellixity.tally.error;

public class MetricValidationException extends TallyException {
  public MetricValidationException(String message) { super(message); }
  public MetricValidationException(String message, Throwable cause) { super(message, cause); }
}
