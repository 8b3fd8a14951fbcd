package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.schema.RecordType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulated, not yet rendered state of one SELECT.\n
 *
 * Owned by a single {@link QueryBuilder}. WHERE predicates and the HAVING clause each carry their own
 * parameters; dialects concatenate them in clause order at render time.\n
 */
public final class QueryDescriptor {
  private final RecordType target;
  private final List<String> projection = new ArrayList<>();
  private final List<String> joins = new ArrayList<>();
  private final List<SqlFragment> predicates = new ArrayList<>();
  private String groupBy;
  private SqlFragment having;
  private String orderBy;
  private Integer limit;
  private Integer offset;

  public QueryDescriptor(RecordType target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  public RecordType target() { return target; }
  /** Empty means {@code *}. */
  public List<String> projection() { return Collections.unmodifiableList(projection); }
  public List<String> joins() { return Collections.unmodifiableList(joins); }
  public List<SqlFragment> predicates() { return Collections.unmodifiableList(predicates); }
  public String groupBy() { return groupBy; }
  public SqlFragment having() { return having; }
  public String orderBy() { return orderBy; }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }

  void projection(List<String> columns) {
    projection.clear();
    projection.addAll(columns);
  }

  void addJoin(String join) { joins.add(join); }
  void addPredicate(SqlFragment predicate) { predicates.add(predicate); }
  void groupBy(String groupBy) { this.groupBy = groupBy; }
  void having(SqlFragment having) { this.having = having; }
  void orderBy(String orderBy) { this.orderBy = orderBy; }
  void limit(Integer limit) { this.limit = limit; }
  void offset(Integer offset) { this.offset = offset; }
}
