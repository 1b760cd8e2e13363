package io.intellixity.tally.model;

import io.intellixity.tally.error.SchemaException;

import java.util.List;
import java.util.Objects;

/**
 * One warehouse table holding event rows.\n
 *
 * The event name comes either from a column ({@code eventNameField}) or, for tables holding a
 * single event type, from a constant {@code eventNameAlias}. Exactly one of the two is required.\n
 * Cardinality limits left null fall back to the owning {@link EventDataSource}.\n
 */
public record EventDataTable(String name,
                             String schema,
                             String catalog,
                             String userIdField,
                             String eventTimeField,
                             String eventNameField,
                             String eventNameAlias,
                             List<String> ignoredFields,
                             List<String> eventSpecificPrefixes,
                             Integer maxEnumCardinality,
                             Integer maxMapKeyCardinality) {
  public EventDataTable {
    Objects.requireNonNull(name, "name");
    if (isBlank(userIdField)) throw new SchemaException("user_id_field is required for table " + name);
    if (isBlank(eventTimeField)) throw new SchemaException("event_time_field is required for table " + name);
    if (!isBlank(eventNameField) && !isBlank(eventNameAlias)) {
      throw new SchemaException("both event_name_alias and event_name_field can't be defined for table " + name);
    }
    if (isBlank(eventNameField) && isBlank(eventNameAlias)) {
      throw new SchemaException("define the event_name_alias or the event_name_field for table " + name);
    }
    ignoredFields = ignoredFields == null ? List.of() : List.copyOf(ignoredFields);
    eventSpecificPrefixes = eventSpecificPrefixes == null ? List.of() : List.copyOf(eventSpecificPrefixes);
  }

  public static EventDataTable of(String name, String userIdField, String eventTimeField, String eventNameField) {
    return new EventDataTable(name, null, null, userIdField, eventTimeField, eventNameField, null,
        List.of(), List.of(), null, null);
  }

  public static EventDataTable single(String name, String userIdField, String eventTimeField, String eventNameAlias) {
    return new EventDataTable(name, null, null, userIdField, eventTimeField, null, eventNameAlias,
        List.of(), List.of(), null, null);
  }

  public EventDataTable withSchema(String schema) {
    return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
        ignoredFields, eventSpecificPrefixes, maxEnumCardinality, maxMapKeyCardinality);
  }

  public EventDataTable withCatalog(String catalog) {
    return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
        ignoredFields, eventSpecificPrefixes, maxEnumCardinality, maxMapKeyCardinality);
  }

  public EventDataTable withIgnoredFields(List<String> ignoredFields) {
    return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
        ignoredFields, eventSpecificPrefixes, maxEnumCardinality, maxMapKeyCardinality);
  }

  public EventDataTable withEventSpecificPrefixes(List<String> prefixes) {
    return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
        ignoredFields, prefixes, maxEnumCardinality, maxMapKeyCardinality);
  }

  public EventDataTable withCardinalityLimits(Integer maxEnumCardinality, Integer maxMapKeyCardinality) {
    return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
        ignoredFields, eventSpecificPrefixes, maxEnumCardinality, maxMapKeyCardinality);
  }

  /** Stable identity: {@code catalog.schema.name} with absent parts omitted. */
  public String id() {
    StringBuilder sb = new StringBuilder();
    if (!isBlank(catalog)) sb.append(catalog).append('.');
    if (!isBlank(schema)) sb.append(schema).append('.');
    return sb.append(name).toString();
  }

  public boolean hasEventNameAlias() { return !isBlank(eventNameAlias); }

  public boolean isIgnored(String fieldPath) { return ignoredFields.contains(fieldPath); }

  public boolean isEventSpecific(String fieldName) {
    for (String p : eventSpecificPrefixes) {
      if (fieldName.startsWith(p)) return true;
    }
    return false;
  }

  /** Columns the metric compiler reads directly; they are never enumerated. */
  public boolean isSystemField(String fieldPath) {
    return fieldPath.equals(userIdField) || fieldPath.equals(eventTimeField) || fieldPath.equals(eventNameField);
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
