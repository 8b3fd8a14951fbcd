package io.intellixity.tessera.persistence.jdbc.sqlite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Connection settings of a SQLite-backed session.
 *
 * <pre>
 * sqlite:
 *   url: jdbc:sqlite:database.db
 *   foreignKeys: true
 *   busyTimeoutMs: 5000
 * </pre>
 */
public record SqliteSettings(String url, boolean foreignKeys, int busyTimeoutMs) {
  public static final String URL_PREFIX = "jdbc:sqlite:";

  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  public SqliteSettings {
    Objects.requireNonNull(url, "url");
    if (!url.startsWith(URL_PREFIX)) throw new IllegalArgumentException("Not a SQLite JDBC url: " + url);
    if (busyTimeoutMs < 0) throw new IllegalArgumentException("busyTimeoutMs must be >= 0");
  }

  /** Foreign keys enforced, 5s busy timeout. */
  public static SqliteSettings defaults(String url) {
    return new SqliteSettings(url, true, 5000);
  }

  public static SqliteSettings inMemory() {
    return defaults(URL_PREFIX + ":memory:");
  }

  /** Reads the {@code sqlite} section of a YAML document; absent keys fall back to {@link #defaults(String)}. */
  public static SqliteSettings load(InputStream in) {
    Objects.requireNonNull(in, "in");
    JsonNode root;
    try {
      root = YAML.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read SQLite settings", e);
    }
    JsonNode s = (root == null) ? null : root.get("sqlite");
    if (s == null || !s.hasNonNull("url")) {
      throw new IllegalArgumentException("SQLite settings require 'sqlite.url'");
    }
    SqliteSettings d = defaults(s.get("url").asText());
    return new SqliteSettings(
        d.url(),
        s.path("foreignKeys").asBoolean(d.foreignKeys()),
        s.path("busyTimeoutMs").asInt(d.busyTimeoutMs()));
  }

  public SqliteSettings withForeignKeys(boolean foreignKeys) {
    return new SqliteSettings(url, foreignKeys, busyTimeoutMs);
  }
}
