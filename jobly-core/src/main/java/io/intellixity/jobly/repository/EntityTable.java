package io.intellixity.jobly.repository;

import io.intellixity.jobly.query.ColumnMap;
import io.intellixity.jobly.query.FilterSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.intellixity.jobly.query.SqlIdentifiers.quote;

/**
 * Declarative description of an entity's table: names, column map, projected fields, key and filters.
 * Built once per entity; immutable.
 *
 * @param name     physical table name
 * @param singular entity label used in messages ("company")
 * @param plural   plural label used in messages ("companies")
 * @param columns  logical field to column map
 * @param fields   logical fields projected by reads, in output order
 * @param keys     logical key fields
 * @param orderBy  ORDER BY expression for list reads
 * @param filters  recognized filter parameters
 */
public record EntityTable(
    String name,
    String singular,
    String plural,
    ColumnMap columns,
    List<String> fields,
    List<String> keys,
    String orderBy,
    FilterSpec filters
) {
  public EntityTable {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(singular, "singular");
    Objects.requireNonNull(plural, "plural");
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(orderBy, "orderBy");
    Objects.requireNonNull(filters, "filters");
    fields = List.copyOf(fields);
    keys = List.copyOf(keys);
    if (keys.isEmpty()) throw new IllegalArgumentException("Entity table '" + name + "' needs a key");
  }

  /** Projection aliasing every column back to its logical field name. */
  public String projection() {
    List<String> items = new ArrayList<>(fields.size());
    for (String field : fields) {
      String column = columns.column(field);
      items.add(column.equals(field) ? quote(column) : quote(column) + " AS " + quote(field));
    }
    return String.join(", ", items);
  }

  public String select() {
    return "SELECT " + projection() + " FROM " + quote(name);
  }

  /** {@code "k1" = $start AND "k2" = $start+1 ...} */
  public String keyPredicate(int startIndex) {
    List<String> parts = new ArrayList<>(keys.size());
    int n = startIndex;
    for (String key : keys) {
      parts.add(quote(columns.column(key)) + " = $" + (n++));
    }
    return String.join(" AND ", parts);
  }

  /** Quoted key columns, for {@code RETURNING}. */
  public String keyColumns() {
    List<String> cols = new ArrayList<>(keys.size());
    for (String key : keys) cols.add(quote(columns.column(key)));
    return String.join(", ", cols);
  }
}
