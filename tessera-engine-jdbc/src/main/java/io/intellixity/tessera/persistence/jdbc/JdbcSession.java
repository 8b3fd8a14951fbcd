package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.exec.ConstraintViolationException;
import io.intellixity.tessera.persistence.exec.QueryException;
import io.intellixity.tessera.persistence.exec.RowReader;
import io.intellixity.tessera.persistence.exec.Session;
import io.intellixity.tessera.persistence.jdbc.bind.JdbcBinder;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Session} over a single JDBC connection.\n
 *
 * The connection is opened on first use and reused by every statement until {@link #close()}. It runs in
 * auto-commit mode, so each DDL, INSERT, UPDATE and DELETE commits on its own. Driver errors are
 * translated into {@link ConstraintViolationException} or {@link QueryException} and never retried.\n
 */
public final class JdbcSession implements Session {
  private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private Connection conn;
  private boolean closed;

  public JdbcSession(JdbcHandle handle, JdbcDialect dialect) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public JdbcSession(DataSource ds, JdbcDialect dialect) {
    this(new JdbcHandle("jdbc", ds), dialect);
  }

  @Override
  public JdbcDialect dialect() {
    return dialect;
  }

  public JdbcHandle handle() {
    return handle;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public <T> List<T> select(SqlStatement ss, RowReader<T> reader) {
    long start = System.nanoTime();
    debugSql("SELECT", ss);
    try (PreparedStatement ps = connection().prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        JdbcRowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(reader.read(row));
        debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw translate("SELECT", ss, e);
    }
  }

  @Override
  public long count(SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("COUNT", ss);
    try (PreparedStatement ps = connection().prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0L;
        debugDone("COUNT", ss, v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw translate("COUNT", ss, e);
    }
  }

  @Override
  public Object insert(SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("INSERT", ss);
    try {
      Connection c = connection();
      return switch (ss.execKind()) {
        case UPDATE_GENERATED_KEYS -> {
          String lastIdSql = dialect.lastInsertIdSql();
          if (lastIdSql != null) {
            int n;
            try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
              bindAll(ps, ss);
              n = ps.executeUpdate();
            }
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(lastIdSql)) {
              Object v = rs.next() ? rs.getObject(1) : null;
              debugDone("INSERT", ss, n, System.nanoTime() - start);
              yield v;
            }
          }
          try (PreparedStatement ps = c.prepareStatement(ss.sql(), Statement.RETURN_GENERATED_KEYS)) {
            bindAll(ps, ss);
            int n = ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
              Object v = (rs != null && rs.next()) ? rs.getObject(1) : null;
              debugDone("INSERT", ss, n, System.nanoTime() - start);
              yield v;
            }
          }
        }
        case UPDATE -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
            bindAll(ps, ss);
            int n = ps.executeUpdate();
            debugDone("INSERT", ss, n, System.nanoTime() - start);
            yield null;
          }
        }
        case QUERY -> throw new IllegalArgumentException("Invalid execKind=QUERY for insert; use UPDATE/UPDATE_GENERATED_KEYS");
      };
    } catch (SQLException e) {
      throw translate("INSERT", ss, e);
    }
  }

  @Override
  public long update(SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("UPDATE", ss);
    try (PreparedStatement ps = connection().prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      long n = ps.executeUpdate();
      debugDone("UPDATE", ss, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw translate("UPDATE", ss, e);
    }
  }

  @Override
  public void execute(String ddl) {
    SqlStatement ss = new SqlStatement(ddl, List.of(), SqlStatement.ExecKind.UPDATE);
    long start = System.nanoTime();
    debugSql("DDL", ss);
    try (Statement st = connection().createStatement()) {
      st.execute(ddl);
      debugDone("DDL", ss, "ok", System.nanoTime() - start);
    } catch (SQLException e) {
      throw translate("DDL", ss, e);
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    if (conn == null) return;
    try {
      conn.close();
      log.debug("tessera.jdbc connection closed handleId={}", handle.id());
    } catch (SQLException e) {
      throw new QueryException("Failed to close connection of " + handle.id(), e);
    } finally {
      conn = null;
    }
  }

  private Connection connection() throws SQLException {
    if (closed) throw new IllegalStateException("Session is closed: " + handle.id());
    if (conn == null) {
      Connection c = handle.client().getConnection();
      c.setAutoCommit(true);
      conn = c;
      log.debug("tessera.jdbc connection opened handleId={} dialect={}", handle.id(), dialect.id());
    }
    return conn;
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.params().size(); i++) {
      JdbcBinder.bind(ps, i + 1, ss.params().get(i));
    }
  }

  private RuntimeException translate(String op, SqlStatement ss, SQLException e) {
    if (dialect.isConstraintViolation(e)) {
      return new ConstraintViolationException(op + " violated a constraint: " + e.getMessage(), e);
    }
    return new QueryException(op + " failed: " + e.getMessage() + " [sql=" + ss.sql() + "]", e);
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc op={} execKind={} bindCount={} handleId={} sql={}",
        op, ss.execKind(), ss.params().size(), handle.id(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && !ss.params().isEmpty()) {
      int idx = 1;
      for (Object v : ss.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof byte[] b) ? b.length : -1;
        log.trace("tessera.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return cs.toString();
    return r.getClass().getSimpleName();
  }
}
