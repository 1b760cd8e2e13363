package io.intellixity.tally.jdbc.dialect;

import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.jdbc.SqlStatement;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.DataType;
import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.Field;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Warehouse-specific SQL generation and value conversion.\n
 *
 * Implementations are registered through {@code META-INF/tally.factories} and looked up
 * by {@link ConnectionType} via {@link Dialects}.\n
 */
public interface SqlDialect {
  ConnectionType connectionType();

  String id();

  String jdbcUrl(Connection connection);

  /** Driver properties beyond user and password, e.g. tokens some drivers expect under their own key. */
  default Map<String, String> driverProperties(Connection connection) { return Map.of(); }

  default String testQuery() { return "SELECT 1"; }

  GroupByStyle groupByStyle();

  String quoteIdent(String ident);

  /** Semantic type of a scalar native type name. */
  DataType mapNativeType(String nativeType);

  /** Column of {@code nativeType}, with sub-fields for struct types and value type for maps/arrays. */
  Field parseField(String name, String nativeType);

  SqlStatement render(QueryPlan plan);

  /** Columns: {@code _event_name}. */
  SqlStatement renderEventNames(EventDataTable table, DiscoveryScope scope);

  /**
   * Columns: {@code _event_name} (event-specific only), then {@code _f0.._fN} holding the
   * distinct values of each field, or NULL when the distinct count reached {@code limit}.
   */
  SqlStatement renderEnumSample(EventDataTable table, List<Field> fields, boolean eventSpecific, int limit,
                                DiscoveryScope scope);

  /** Columns: {@code _event_name} (event-specific only), {@code _keys}. */
  SqlStatement renderMapKeys(EventDataTable table, Field mapField, boolean eventSpecific, int limit,
                             DiscoveryScope scope);

  /** JDBC value for a bound literal. */
  Object bindValue(Object value);

  LocalDateTime decodeDateTime(Object value);

  /** Values of an aggregated distinct-value column. */
  List<Object> decodeArrayAgg(Object value);
}
