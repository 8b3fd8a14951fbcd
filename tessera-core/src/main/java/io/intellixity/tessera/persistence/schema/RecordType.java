package io.intellixity.tessera.persistence.schema;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Declared schema of one table: a type name, an optional table name and an ordered attribute map.\n
 *
 * Instances are immutable and built through {@link #builder(String)}. Declaration order is kept and drives
 * column order in generated DDL and INSERT statements.\n
 */
public final class RecordType {
  /** Primary-key attribute name used when no field is marked as primary key. */
  public static final String DEFAULT_PRIMARY_KEY = "id";

  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String name;
  private final String table;
  private final Map<String, AttributeDef> attributes;

  private RecordType(String name, String table, Map<String, AttributeDef> attributes) {
    this.name = name;
    this.table = table;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() { return name; }

  /** Table name, or {@code null} for a type not bound to a table. */
  public String table() { return table; }

  public Map<String, AttributeDef> attributes() { return attributes; }

  public boolean declares(String attribute) {
    return attributes.containsKey(attribute);
  }

  public AttributeDef attribute(String attribute) {
    return attributes.get(attribute);
  }

  /** Fields marked as primary key, in declaration order. */
  public List<String> primaryKeyColumns() {
    List<String> out = new ArrayList<>();
    for (var e : attributes.entrySet()) {
      if (e.getValue() instanceof FieldDef fd && fd.primaryKey()) out.add(e.getKey());
    }
    return out;
  }

  /**
   * Single primary-key attribute: the field marked as primary key, or {@value #DEFAULT_PRIMARY_KEY} if none is.
   *
   * @throws SchemaException if more than one field is marked as primary key
   */
  public String primaryKey() {
    List<String> pks = primaryKeyColumns();
    if (pks.size() > 1) {
      throw new SchemaException("Ambiguous primary key for record type " + name + ": " + pks);
    }
    return pks.isEmpty() ? DEFAULT_PRIMARY_KEY : pks.get(0);
  }

  /** True for the conventional {@value #DEFAULT_PRIMARY_KEY} key of a type that neither declares nor marks one. */
  public boolean isImplicitKey(String attribute) {
    return DEFAULT_PRIMARY_KEY.equals(attribute) && !declares(attribute) && primaryKeyColumns().isEmpty();
  }

  /** Declared base type of an attribute, or {@code null} if the attribute is not declared. */
  public BaseType typeOf(String attribute) {
    AttributeDef ad = attributes.get(attribute);
    return ad == null ? null : ad.type();
  }

  static boolean isIdentifier(String s) {
    return s != null && IDENT.matcher(s).matches();
  }

  @Override
  public String toString() {
    return "RecordType[" + name + (table == null ? "" : " -> " + table) + "]";
  }

  public static final class Builder {
    private final String name;
    private String table;
    private final Map<String, AttributeDef> attributes = new LinkedHashMap<>();

    private Builder(String name) {
      if (name == null || name.isBlank()) throw new SchemaException("Record type name is blank");
      this.name = name;
    }

    public Builder table(String table) {
      if (table != null && !isIdentifier(table)) {
        throw new SchemaException("Invalid table name for record type " + name + ": " + table);
      }
      this.table = table;
      return this;
    }

    public Builder field(String attribute, FieldDef def) {
      return attribute(attribute, def);
    }

    public Builder relation(String attribute, RelationDef def) {
      return attribute(attribute, def);
    }

    public Builder attribute(String attribute, AttributeDef def) {
      Objects.requireNonNull(def, "def");
      if (!isIdentifier(attribute)) {
        throw new SchemaException("Invalid attribute name on record type " + name + ": " + attribute);
      }
      if (attribute.startsWith("_")) {
        throw new SchemaException("Attribute names starting with '_' are reserved: " + name + "." + attribute);
      }
      if (attributes.putIfAbsent(attribute, def) != null) {
        throw new SchemaException("Duplicate attribute on record type " + name + ": " + attribute);
      }
      return this;
    }

    public RecordType build() {
      return new RecordType(name, table, attributes);
    }
  }
}
