package io.intellixity.tessera.persistence.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC data source plus an identifier used in logs. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;

  public JdbcHandle(String id, DataSource client) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
  }

  public String id() { return id; }
  public DataSource client() { return client; }
}
