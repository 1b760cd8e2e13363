package io.intellixity.tally.compile;

import io.intellixity.tally.error.SchemaException;
import io.intellixity.tally.expr.ColumnRef;
import io.intellixity.tally.model.DataType;
import io.intellixity.tally.model.DiscoveredTable;
import io.intellixity.tally.model.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns a dotted field path into a {@link ColumnRef} by walking parent links through the
 * table's field registry, so map keys containing dots resolve correctly.\n
 */
public final class FieldResolver {
  public Optional<ColumnRef> column(DiscoveredTable table, String alias, String path) {
    if (table.table().isSystemField(path)) return Optional.of(ColumnRef.of(alias, path));
    Optional<Field> leaf = table.field(path);
    if (leaf.isEmpty()) return Optional.empty();

    List<ColumnRef.PathStep> steps = new ArrayList<>();
    Field f = leaf.get();
    while (!f.isRoot()) {
      steps.add(new ColumnRef.PathStep(f.name(), f.parentType() == DataType.MAP));
      String parentPath = f.parentPath();
      f = table.field(parentPath).orElseThrow(() -> new SchemaException(
          "Field '" + path + "' refers to unknown parent '" + parentPath + "' in table " + table.table().id()));
    }
    Collections.reverse(steps);
    return Optional.of(new ColumnRef(alias, f.name(), steps));
  }
}
