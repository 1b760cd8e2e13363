package io.intellixity.tally.model;

import io.intellixity.tally.error.SchemaException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A warehouse connection plus the event tables it exposes and the discovery defaults. */
public final class EventDataSource {
  public static final int DEFAULT_MAX_ENUM_CARDINALITY = 300;
  public static final int DEFAULT_MAX_MAP_KEY_CARDINALITY = 300;
  public static final int DEFAULT_PROPERTY_SAMPLE_SIZE = 10_000;

  private final String id;
  private final Connection connection;
  private final List<EventDataTable> tables;
  private final DateRange defaultDiscoveryRange;
  private final int maxEnumCardinality;
  private final int maxMapKeyCardinality;
  private final int propertySampleSize;

  public EventDataSource(String id,
                         Connection connection,
                         List<EventDataTable> tables,
                         DateRange defaultDiscoveryRange,
                         int maxEnumCardinality,
                         int maxMapKeyCardinality,
                         int propertySampleSize) {
    this.id = Objects.requireNonNull(id, "id");
    this.connection = Objects.requireNonNull(connection, "connection");
    if (tables == null || tables.isEmpty()) {
      throw new SchemaException("at least one event data table is required for source " + id);
    }
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    for (EventDataTable t : tables) {
      if (!ids.add(t.id())) throw new SchemaException("duplicate event data table " + t.id() + " in source " + id);
    }
    if (maxEnumCardinality <= 0) throw new IllegalArgumentException("maxEnumCardinality must be > 0");
    if (maxMapKeyCardinality <= 0) throw new IllegalArgumentException("maxMapKeyCardinality must be > 0");
    if (propertySampleSize <= 0) throw new IllegalArgumentException("propertySampleSize must be > 0");
    this.tables = List.copyOf(tables);
    this.defaultDiscoveryRange = defaultDiscoveryRange;
    this.maxEnumCardinality = maxEnumCardinality;
    this.maxMapKeyCardinality = maxMapKeyCardinality;
    this.propertySampleSize = propertySampleSize;
  }

  public static EventDataSource of(String id, Connection connection, List<EventDataTable> tables) {
    return new EventDataSource(id, connection, tables, null,
        DEFAULT_MAX_ENUM_CARDINALITY, DEFAULT_MAX_MAP_KEY_CARDINALITY, DEFAULT_PROPERTY_SAMPLE_SIZE);
  }

  public EventDataSource withDefaultDiscoveryRange(DateRange range) {
    return new EventDataSource(id, connection, tables, range, maxEnumCardinality, maxMapKeyCardinality, propertySampleSize);
  }

  public EventDataSource withLimits(int maxEnumCardinality, int maxMapKeyCardinality, int propertySampleSize) {
    return new EventDataSource(id, connection, tables, defaultDiscoveryRange,
        maxEnumCardinality, maxMapKeyCardinality, propertySampleSize);
  }

  public String id() { return id; }
  public Connection connection() { return connection; }
  public List<EventDataTable> tables() { return tables; }
  public DateRange defaultDiscoveryRange() { return defaultDiscoveryRange; }
  public int maxEnumCardinality() { return maxEnumCardinality; }
  public int maxMapKeyCardinality() { return maxMapKeyCardinality; }
  public int propertySampleSize() { return propertySampleSize; }

  public Optional<EventDataTable> table(String tableId) {
    return tables.stream().filter(t -> t.id().equals(tableId)).findFirst();
  }

  public int enumLimitFor(EventDataTable table) {
    return table.maxEnumCardinality() != null ? table.maxEnumCardinality() : maxEnumCardinality;
  }

  public int mapKeyLimitFor(EventDataTable table) {
    return table.maxMapKeyCardinality() != null ? table.maxMapKeyCardinality() : maxMapKeyCardinality;
  }
}
