package io.intellixity.tally.jdbc;

/** A positional parameter value of a rendered statement. */
public record Bind(Object value) {}
