package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.exec.Session;
import io.intellixity.tessera.persistence.record.Entity;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.sql.SqlStatement;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fluent SELECT builder over one record type.\n
 *
 * {@code where} and {@code join} accumulate in call order; {@code groupBy}, {@code having},
 * {@code orderBy}, {@code limit} and {@code offset} keep only the last value. Rendering order is fixed by
 * the session's dialect, so configuration calls may come in any order. Condition, join and ordering text
 * is trusted raw SQL; literal values must be passed as parameters.\n
 */
public final class QueryBuilder {
  private final Session session;
  private final QueryDescriptor query;

  public QueryBuilder(Session session, RecordType target) {
    this.session = Objects.requireNonNull(session, "session");
    this.query = new QueryDescriptor(target);
  }

  public QueryBuilder select(String... columns) {
    query.projection(columns == null ? List.of() : Arrays.asList(columns));
    return this;
  }

  public QueryBuilder where(String condition, Object... params) {
    query.addPredicate(SqlFragment.of(condition, params));
    return this;
  }

  public QueryBuilder join(String table, String on) {
    return join(table, on, JoinType.INNER);
  }

  public QueryBuilder join(String table, String on, JoinType type) {
    requireText(table, "join table");
    requireText(on, "join condition");
    Objects.requireNonNull(type, "type");
    query.addJoin(type.name() + " JOIN " + table + " ON " + on);
    return this;
  }

  public QueryBuilder leftJoin(String table, String on) {
    return join(table, on, JoinType.LEFT);
  }

  public QueryBuilder rightJoin(String table, String on) {
    return join(table, on, JoinType.RIGHT);
  }

  public QueryBuilder groupBy(String columns) {
    query.groupBy(requireText(columns, "group by"));
    return this;
  }

  public QueryBuilder having(String condition, Object... params) {
    query.having(SqlFragment.of(condition, params));
    return this;
  }

  public QueryBuilder orderBy(String expression) {
    return orderBy(expression, Direction.ASC);
  }

  public QueryBuilder orderBy(String expression, Direction direction) {
    requireText(expression, "order by");
    query.orderBy(expression + " " + (direction == null ? Direction.ASC : direction).name());
    return this;
  }

  public QueryBuilder limit(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    query.limit(limit);
    return this;
  }

  public QueryBuilder offset(int offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    query.offset(offset);
    return this;
  }

  public QueryDescriptor descriptor() {
    return query;
  }

  public SqlStatement toStatement() {
    return session.dialect().renderSelect(query);
  }

  public SqlStatement toCountStatement() {
    return session.dialect().renderCount(query);
  }

  /** All matching rows, in the order the engine returns them. */
  public List<Entity> all() {
    RecordType type = query.target();
    return session.select(toStatement(), row -> Entity.fromRow(session, type, row.toMap()));
  }

  /** Forces {@code LIMIT 1}, replacing any previous limit. */
  public Optional<Entity> first() {
    query.limit(1);
    List<Entity> rows = all();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Counts rows matching the WHERE predicates; joins, grouping, ordering and paging are ignored. */
  public long count() {
    return session.count(toCountStatement());
  }

  public boolean exists() {
    return count() > 0;
  }

  private static String requireText(String s, String what) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException(what + " is blank");
    return s;
  }
}
