package io.intellixity.tessera.persistence.exec;

import io.intellixity.tessera.persistence.query.QueryBuilder;
import io.intellixity.tessera.persistence.record.Entity;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.sql.SqlDialect;
import io.intellixity.tessera.persistence.sql.SqlStatement;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicitly owned connection to one storage engine.\n
 *
 * Every record instance and query builder is bound to the session it was created from. Mutating calls
 * commit immediately; there is no multi-statement transaction API. Implementations are not thread-safe.\n
 */
public interface Session extends AutoCloseable {
  SqlDialect dialect();

  <T> List<T> select(SqlStatement statement, RowReader<T> reader);

  long count(SqlStatement statement);

  /** Executes an INSERT and returns the storage-assigned key, or {@code null} if none was requested. */
  Object insert(SqlStatement statement);

  /** Executes an UPDATE or DELETE and returns the number of affected rows. */
  long update(SqlStatement statement);

  /** Executes a DDL statement without parameters. */
  void execute(String ddl);

  @Override
  void close();

  /** Compiles and executes the {@code CREATE TABLE IF NOT EXISTS} statement of {@code type}. */
  default void createTable(RecordType type) {
    execute(dialect().renderCreateTable(type));
  }

  default QueryBuilder query(RecordType type) {
    return new QueryBuilder(this, type);
  }

  /** New, unsaved instance of {@code type}. */
  default Entity newRecord(RecordType type) {
    return new Entity(this, type);
  }

  /** New, unsaved instance populated with {@code values}; every given attribute is dirty. */
  default Entity newRecord(RecordType type, Map<String, ?> values) {
    Entity e = new Entity(this, type);
    values.forEach(e::set);
    return e;
  }

  default Optional<Entity> find(RecordType type, Object primaryKey) {
    if (primaryKey == null) return Optional.empty();
    return query(type).where(type.primaryKey() + " = ?", primaryKey).first();
  }
}
