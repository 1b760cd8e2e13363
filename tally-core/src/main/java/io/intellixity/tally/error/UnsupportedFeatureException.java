package io.intellixity.tally.error;

/** The selected dialect cannot express the requested construct (e.g. QUARTER buckets, MAP access). */
public class UnsupportedFeatureException extends TallyException {
  public UnsupportedFeatureException(String message) { super(message); }
  public UnsupportedFeatureException(String message, Throwable cause) { super(message, cause); }
}
