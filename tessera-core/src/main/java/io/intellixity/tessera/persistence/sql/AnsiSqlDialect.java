package io.intellixity.tessera.persistence.sql;

import io.intellixity.tessera.persistence.dmlast.*;
import io.intellixity.tessera.persistence.query.QueryDescriptor;
import io.intellixity.tessera.persistence.query.SqlFragment;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.schema.SchemaCompiler;
import io.intellixity.tessera.persistence.schema.SchemaException;
import io.intellixity.tessera.persistence.sql.SqlStatement.ExecKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic SQL dialect base.\n
 *
 * Renders SELECT clauses in fixed order regardless of how the query was assembled:
 * {@code SELECT … FROM t [JOIN …] [WHERE …] [GROUP BY …] [HAVING …] [ORDER BY …] [LIMIT n] [OFFSET n]}.
 * Engine-specific dialects override the paging and key read-back hooks.\n
 */
public class AnsiSqlDialect implements SqlDialect {
  private final SchemaCompiler schemaCompiler = new SchemaCompiler();

  @Override
  public String id() {
    return "ansi";
  }

  @Override
  public String renderCreateTable(RecordType type) {
    return schemaCompiler.compile(type);
  }

  @Override
  public final SqlStatement renderSelect(QueryDescriptor q) {
    List<Object> params = new ArrayList<>();
    String projection = q.projection().isEmpty() ? "*" : String.join(", ", q.projection());
    StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(requireTable(q));

    for (String join : q.joins()) sql.append(' ').append(join);
    appendWhere(sql, params, q.predicates());
    if (q.groupBy() != null) sql.append(" GROUP BY ").append(q.groupBy());
    if (q.having() != null) {
      sql.append(" HAVING ").append(q.having().sql());
      params.addAll(q.having().params());
    }
    if (q.orderBy() != null) sql.append(" ORDER BY ").append(q.orderBy());
    appendPage(sql, q.limit(), q.offset());

    return new SqlStatement(sql.toString(), params, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement renderCount(QueryDescriptor q) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(requireTable(q));
    appendWhere(sql, params, q.predicates());
    return new SqlStatement(sql.toString(), params, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement renderDml(DmlAst dml) {
    if (dml instanceof InsertAst ins) return renderInsert(ins);
    if (dml instanceof UpdateAst upd) return renderUpdate(upd);
    if (dml instanceof DeleteAst del) return renderDelete(del);
    throw new IllegalArgumentException("Unknown DmlAst: " + dml);
  }

  protected SqlStatement renderInsert(InsertAst ins) {
    ExecKind kind = ins.keyColumn() == null ? ExecKind.UPDATE : ExecKind.UPDATE_GENERATED_KEYS;
    if (ins.columns().isEmpty()) {
      return new SqlStatement("INSERT INTO " + ins.table() + " DEFAULT VALUES", List.of(), kind);
    }
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (ColumnBind cb : ins.columns()) {
      cols.add(cb.column());
      ph.add("?");
      params.add(cb.value());
    }
    String sql = "INSERT INTO " + ins.table() +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, params, kind);
  }

  protected SqlStatement renderUpdate(UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    List<String> sets = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) {
      sets.add(cb.column() + " = ?");
      params.add(cb.value());
    }
    params.add(upd.keyValue());
    String sql = "UPDATE " + upd.table() + " SET " + String.join(", ", sets) + " WHERE " + upd.keyColumn() + " = ?";
    return new SqlStatement(sql, params, ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(DeleteAst del) {
    List<Object> params = new ArrayList<>();
    params.add(del.keyValue());
    return new SqlStatement("DELETE FROM " + del.table() + " WHERE " + del.keyColumn() + " = ?", params, ExecKind.UPDATE);
  }

  /** Default renders {@code LIMIT n} and {@code OFFSET n} independently. */
  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  private static void appendWhere(StringBuilder sql, List<Object> params, List<SqlFragment> predicates) {
    if (predicates.isEmpty()) return;
    List<String> parts = new ArrayList<>(predicates.size());
    for (SqlFragment p : predicates) {
      parts.add(p.sql());
      params.addAll(p.params());
    }
    sql.append(" WHERE ").append(String.join(" AND ", parts));
  }

  private static String requireTable(QueryDescriptor q) {
    String t = q.target().table();
    if (t == null || t.isBlank()) {
      throw new SchemaException("Table name not defined for record type " + q.target().name());
    }
    return t;
  }
}
