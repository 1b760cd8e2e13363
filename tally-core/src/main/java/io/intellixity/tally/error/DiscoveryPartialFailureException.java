package io.intellixity.tally.error;

import io.intellixity.tally.discovery.DiscoveryResult;

import java.util.Objects;

/** Raised on demand when some tables failed discovery; the successful part stays available. */
public final class DiscoveryPartialFailureException extends TallyException {
  private final DiscoveryResult result;

  public DiscoveryPartialFailureException(String message, DiscoveryResult result) {
    super(message);
    this.result = Objects.requireNonNull(result, "result");
    result.failures().values().forEach(this::addSuppressed);
  }

  public DiscoveryResult result() { return result; }
}
