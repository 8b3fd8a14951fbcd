package io.intellixity.tessera.persistence.record;

import io.intellixity.tessera.persistence.dmlast.DmlPlanner;
import io.intellixity.tessera.persistence.exec.Session;
import io.intellixity.tessera.persistence.schema.BaseType;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One row of a record type, held in memory with per-attribute change tracking.\n
 *
 * Writes go through {@link #set(String, Object)}, which is checked against the type's declared attributes
 * and marks the attribute dirty. {@link #save()} issues an INSERT while the primary key is unset and an
 * UPDATE of the dirty attributes afterwards. The dirty set is cleared only when the statement succeeded.\n
 */
public final class Entity {
  private static final Logger log = LoggerFactory.getLogger(Entity.class);
  private static final DmlPlanner PLANNER = new DmlPlanner();

  private final Session session;
  private final RecordType type;
  private final Map<String, Object> values = new LinkedHashMap<>();
  private final Set<String> dirty = new LinkedHashSet<>();

  public Entity(Session session, RecordType type) {
    this.session = Objects.requireNonNull(session, "session");
    this.type = Objects.requireNonNull(type, "type");
  }

  /** Bound, clean instance built from a storage row. Values are normalized to the declared base types. */
  public static Entity fromRow(Session session, RecordType type, Map<String, Object> row) {
    Entity e = new Entity(session, type);
    for (var c : row.entrySet()) {
      e.values.put(c.getKey(), e.normalize(c.getKey(), c.getValue()));
    }
    return e;
  }

  public RecordType type() { return type; }

  /**
   * Current value of {@code attribute}. Declared attributes that were never set read as {@code null};
   * columns materialized from a row (projections, joins) are readable even when undeclared.
   *
   * @throws UnknownAttributeException if the attribute is neither declared nor loaded
   */
  public Object get(String attribute) {
    if (values.containsKey(attribute)) return values.get(attribute);
    if (isWritable(attribute)) return null;
    throw new UnknownAttributeException(type.name(), attribute);
  }

  public <T> T get(String attribute, Class<T> as) {
    return as.cast(get(attribute));
  }

  /**
   * Sets {@code attribute} and marks it dirty.
   *
   * @throws UnknownAttributeException if the type does not declare the attribute
   */
  public Entity set(String attribute, Object value) {
    if (!isWritable(attribute)) throw new UnknownAttributeException(type.name(), attribute);
    values.put(attribute, normalize(attribute, value));
    dirty.add(attribute);
    return this;
  }

  /** Snapshot of the in-memory values in insertion order. */
  public Map<String, Object> values() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Set<String> dirtyAttributes() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(dirty));
  }

  public boolean isDirty() {
    return !dirty.isEmpty();
  }

  public Object primaryKeyValue() {
    return values.get(type.primaryKey());
  }

  /** True once the primary key holds a value (loaded, inserted or set explicitly). */
  public boolean isBound() {
    return primaryKeyValue() != null;
  }

  /**
   * Inserts while the primary key is unset, otherwise updates the dirty non-key attributes.
   * <p>
   * An UPDATE that matches no row (a caller-assigned key that was never inserted) changes nothing and is
   * not an error; it is logged at debug with {@code affected=0}. A dirty set holding only the key is a
   * skipped round trip.
   */
  public void save() {
    requireTable("save");
    String pk = type.primaryKey();

    if (values.get(pk) != null) {
      if (dirty.isEmpty() || (dirty.size() == 1 && dirty.contains(pk))) {
        log.debug("tessera.record op=UPDATE type={} pk={} skipped=no-dirty-attributes", type.name(), values.get(pk));
        dirty.clear();
        return;
      }
      SqlStatement ss = session.dialect().renderDml(PLANNER.planUpdate(type, values, dirty));
      long n = session.update(ss);
      if (n == 0) {
        log.debug("tessera.record op=UPDATE type={} pk={} affected=0", type.name(), values.get(pk));
      }
    } else {
      SqlStatement ss = session.dialect().renderDml(PLANNER.planInsert(type, values));
      Object key = session.insert(ss);
      if (key != null) values.put(pk, normalize(pk, key));
    }
    dirty.clear();
  }

  public void delete() {
    requireTable("delete");
    Object pkValue = primaryKeyValue();
    if (pkValue == null) {
      throw new PersistenceException("Cannot delete a " + type.name() + " record without a primary key value");
    }
    session.update(session.dialect().renderDml(PLANNER.planDelete(type, pkValue)));
  }

  /** Referenced row through the conventional foreign key {@code <singular target table>_id}. */
  public Optional<Entity> belongsTo(RecordType target) {
    return belongsTo(target, ForeignKeys.conventionFor(target));
  }

  /** Row of {@code target} whose primary key equals this instance's {@code foreignKey} value. */
  public Optional<Entity> belongsTo(RecordType target, String foreignKey) {
    Object fk = values.get(foreignKey);
    if (fk == null) return Optional.empty();
    return session.query(target).where(target.primaryKey() + " = ?", fk).first();
  }

  /** Rows of {@code target} referencing this instance through {@code <singular own table>_id}. */
  public List<Entity> hasMany(RecordType target) {
    return hasMany(target, ForeignKeys.conventionFor(type));
  }

  public List<Entity> hasMany(RecordType target, String foreignKey) {
    Object pkValue = primaryKeyValue();
    if (pkValue == null) return List.of();
    return session.query(target).where(foreignKey + " = ?", pkValue).all();
  }

  private boolean isWritable(String attribute) {
    return type.declares(attribute) || type.isImplicitKey(attribute);
  }

  private Object normalize(String attribute, Object value) {
    BaseType bt = type.typeOf(attribute);
    if (bt == null && type.isImplicitKey(attribute)) bt = BaseType.INTEGER;
    return bt == null ? value : bt.normalize(value);
  }

  private void requireTable(String op) {
    if (type.table() == null || type.table().isBlank()) {
      throw new PersistenceException("Cannot " + op + " " + type.name() + ": table name not defined");
    }
  }

  @Override
  public String toString() {
    return type.name() + values;
  }
}
