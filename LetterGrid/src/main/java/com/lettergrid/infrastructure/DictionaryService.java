package com.lettergrid.infrastructure;

import com.lettergrid.application.port.Dictionary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

/**
 * Dictionary backed by a read-only SQLite database with a {@code dict(word)} table.
 *
 * <p>Lookups are parameterized queries on the lower-cased word (Locale.ROOT) over one shared
 * connection guarded by a lock. A lookup that fails counts as "not a word".
 */
@Service
public class DictionaryService implements Dictionary {
  private static final Logger log = LoggerFactory.getLogger(DictionaryService.class);

  private static final String URL_PREFIX = "jdbc:sqlite:";
  private static final String SQL_IS_WORD = "SELECT 1 FROM dict WHERE word = ? LIMIT 1";
  private static final String SQL_COUNT = "SELECT COUNT(*) FROM dict";

  private final String jdbcUrl;
  private final Object lock = new Object();

  private Connection conn;

  public DictionaryService(@Value("${lettergrid.dictionary-jdbc-url}") String jdbcUrl) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "lettergrid.dictionary-jdbc-url");
  }

  /**
   * Open the dictionary read-only and make sure it has words in it.
   *
   * @throws IllegalStateException if the database file is missing or the table is empty
   * @throws SQLException if the database cannot be opened
   */
  @PostConstruct
  public void load() throws SQLException {
    long t0 = System.nanoTime();
    requireDatabaseFile(jdbcUrl);

    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setReadOnly(true);
    cfg.setOpenMode(SQLiteOpenMode.READONLY);
    cfg.setBusyTimeout(3000);
    cfg.setTempStore(SQLiteConfig.TempStore.MEMORY);

    Connection c = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
    long words;
    try (Statement s = c.createStatement()) {
      s.execute("PRAGMA query_only=ON");
      try (ResultSet rs = s.executeQuery(SQL_COUNT)) {
        words = rs.next() ? rs.getLong(1) : 0;
      }
    } catch (SQLException e) {
      c.close();
      throw e;
    }
    if (words == 0) {
      c.close();
      throw new IllegalStateException("Dictionary has no words: " + jdbcUrl);
    }
    synchronized (lock) {
      conn = c;
    }
    log.info("Dictionary loaded: {} words in {} ms", words, (System.nanoTime() - t0) / 1_000_000);
  }

  private static void requireDatabaseFile(String url) {
    if (!url.startsWith(URL_PREFIX)) return;
    String path = url.substring(URL_PREFIX.length());
    if (path.isEmpty() || path.startsWith(":")) return;
    Path db = Path.of(path).toAbsolutePath().normalize();
    if (Files.notExists(db)) {
      throw new IllegalStateException("Dictionary DB not found: " + db);
    }
  }

  @PreDestroy
  public void close() {
    synchronized (lock) {
      if (conn != null) {
        try {
          conn.close();
        } catch (SQLException e) {
          log.debug("Closing dictionary connection failed: {}", e.getMessage());
        }
      }
      conn = null;
    }
  }

  /**
   * @param word candidate, any case (may be null)
   * @return true if the lower-cased word is in the dictionary
   */
  @Override
  public boolean isValidWord(String word) {
    String w = norm(word);
    if (w == null) return false;
    synchronized (lock) {
      if (conn == null) return false;
      try (PreparedStatement ps = conn.prepareStatement(SQL_IS_WORD)) {
        ps.setString(1, w);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next();
        }
      } catch (SQLException e) {
        log.debug("isValidWord lookup failed for '{}': {}", w, e.getMessage());
        return false;
      }
    }
  }

  private static String norm(String s) {
    if (s == null) return null;
    String n = s.trim().toLowerCase(Locale.ROOT);
    return n.isEmpty() ? null : n;
  }
}
