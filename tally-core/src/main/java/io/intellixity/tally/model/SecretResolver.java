package io.intellixity.tally.model;

import java.util.Objects;

/** Supplies the connection password lazily so it never has to live in a serialized descriptor. */
public interface SecretResolver {
  String resolve();

  static SecretResolver constant(String secret) { return new Constant(secret); }

  static SecretResolver env(String variable) { return new EnvVar(variable); }

  record Constant(String secret) implements SecretResolver {
    @Override public String resolve() { return secret; }
    @Override public String toString() { return "Constant[***]"; }
  }

  record EnvVar(String variable) implements SecretResolver {
    public EnvVar {
      Objects.requireNonNull(variable, "variable");
    }

    @Override
    public String resolve() {
      String v = System.getenv(variable);
      if (v == null) throw new IllegalStateException("Environment variable is not set: " + variable);
      return v;
    }
  }
}
