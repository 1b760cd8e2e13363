package io.intellixity.tally.examples.service;

import io.intellixity.tally.discovery.DiscoveryEngine;
import io.intellixity.tally.discovery.DiscoveryResult;
import io.intellixity.tally.examples.engine.Sources;
import io.intellixity.tally.jdbc.JdbcEventAdapter;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.schema.SchemaRegistry;
import org.springframework.stereotype.Service;

@Service
public class DiscoveryService {
  private final Sources sources;
  private final SchemaRegistry registry;

  public DiscoveryService(Sources sources, SchemaRegistry registry) {
    this.sources = sources;
    this.registry = registry;
  }

  public DiscoveryResult discover(String sourceId) {
    JdbcEventAdapter adapter = sources.adapter(sourceId);
    return new DiscoveryEngine(adapter, registry).discover(adapter.source());
  }

  /** Latest published schema, discovering on first use. */
  public DiscoveredEventDataSource schema(String sourceId) {
    return registry.current(sourceId).orElseGet(() -> discover(sourceId).snapshot());
  }
}
