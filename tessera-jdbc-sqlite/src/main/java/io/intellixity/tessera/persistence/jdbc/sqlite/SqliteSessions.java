package io.intellixity.tessera.persistence.jdbc.sqlite;

import io.intellixity.tessera.persistence.jdbc.JdbcHandle;
import io.intellixity.tessera.persistence.jdbc.JdbcSession;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.util.Objects;

/** Opens {@link JdbcSession}s on SQLite databases. */
public final class SqliteSessions {
  private SqliteSessions() {}

  public static JdbcSession open(SqliteSettings settings) {
    Objects.requireNonNull(settings, "settings");
    SQLiteConfig cfg = new SQLiteConfig();
    cfg.enforceForeignKeys(settings.foreignKeys());
    cfg.setBusyTimeout(settings.busyTimeoutMs());

    SQLiteDataSource ds = new SQLiteDataSource(cfg);
    ds.setUrl(settings.url());
    return new JdbcSession(new JdbcHandle(settings.url(), ds), new SqliteDialect());
  }

  public static JdbcSession open(String url) {
    return open(SqliteSettings.defaults(url));
  }
}
