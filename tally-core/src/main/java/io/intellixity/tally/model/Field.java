package io.intellixity.tally.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A column or nested attribute of an event table.\n
 *
 * Children are owned by their parent; a child only knows its parent's dotted path and type,
 * which callers resolve through the discovered schema when they need the parent itself.\n
 */
public final class Field {
  private final String name;
  private final DataType type;
  private final DataType valueType;
  private final String parentPath;
  private final DataType parentType;
  private final List<Field> subFields;

  private Field(String name, DataType type, DataType valueType, String parentPath, DataType parentType, List<Field> subFields) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("field name is blank");
    this.valueType = valueType;
    this.parentPath = parentPath;
    this.parentType = parentType;
    String path = parentPath == null ? name : parentPath + "." + name;
    List<Field> children = new ArrayList<>();
    if (subFields != null) {
      for (Field sf : subFields) children.add(sf.reparent(path, type));
    }
    this.subFields = List.copyOf(children);
  }

  public static Field of(String name, DataType type) {
    return new Field(name, type, null, null, null, List.of());
  }

  public static Field struct(String name, List<Field> subFields) {
    return new Field(name, DataType.STRUCT, null, null, null, subFields);
  }

  /** A map column whose values are of {@code valueType}; keys become sub-fields once discovered. */
  public static Field map(String name, DataType valueType, List<Field> keys) {
    return new Field(name, DataType.MAP, valueType, null, null, keys);
  }

  public static Field array(String name, DataType elementType) {
    return new Field(name, DataType.ARRAY, elementType, null, null, List.of());
  }

  public String name() { return name; }
  public DataType type() { return type; }
  /** Value type of a MAP or element type of an ARRAY; null otherwise. */
  public DataType valueType() { return valueType; }
  public String parentPath() { return parentPath; }
  public DataType parentType() { return parentType; }
  public List<Field> subFields() { return subFields; }

  public String path() { return parentPath == null ? name : parentPath + "." + name; }

  public boolean isRoot() { return parentPath == null; }

  public boolean hasSubFields() { return !subFields.isEmpty(); }

  public Field withSubFields(List<Field> subFields) {
    return new Field(name, type, valueType, parentPath, parentType, subFields);
  }

  /** Enumerable leaves: this field itself, or the flattened leaves of its sub-fields. Arrays and key-less maps have none. */
  public List<Field> leaves() {
    if (type == DataType.ARRAY || (type == DataType.MAP && subFields.isEmpty())) return List.of();
    if (subFields.isEmpty()) return List.of(this);
    List<Field> out = new ArrayList<>();
    for (Field sf : subFields) out.addAll(sf.leaves());
    return out;
  }

  /** This field and every descendant, parents first. */
  public List<Field> flatten() {
    List<Field> out = new ArrayList<>();
    out.add(this);
    for (Field sf : subFields) out.addAll(sf.flatten());
    return out;
  }

  private Field reparent(String newParentPath, DataType newParentType) {
    return new Field(name, type, valueType, newParentPath, newParentType, subFields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Field f)) return false;
    return name.equals(f.name) && type == f.type && valueType == f.valueType
        && Objects.equals(parentPath, f.parentPath) && parentType == f.parentType
        && subFields.equals(f.subFields);
  }

  @Override
  public int hashCode() { return Objects.hash(name, type, valueType, parentPath, subFields); }

  @Override
  public String toString() { return path() + ":" + type; }
}
