package com.lettergrid.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DictionaryServiceTest {

  @TempDir Path dir;

  private String createDictionary(String... words) throws SQLException {
    String url = "jdbc:sqlite:" + dir.resolve("dict.db");
    try (Connection c = DriverManager.getConnection(url);
        Statement s = c.createStatement()) {
      s.execute("CREATE TABLE dict (word TEXT PRIMARY KEY)");
      for (String w : words) {
        s.execute("INSERT INTO dict(word) VALUES ('" + w + "')");
      }
    }
    return url;
  }

  @Test
  void looksUpLowerCasedTrimmedWords() throws SQLException {
    DictionaryService dictionary = new DictionaryService(createDictionary("cat", "dog"));
    dictionary.load();
    try {
      assertThat(dictionary.isValidWord(" Cat ")).isTrue();
      assertThat(dictionary.isValidWord("DOG")).isTrue();
      assertThat(dictionary.isValidWord("cow")).isFalse();
      assertThat(dictionary.isValidWord("   ")).isFalse();
    } finally {
      dictionary.close();
    }
  }

  @Test
  void missingDatabaseFailsStartup() {
    DictionaryService dictionary =
        new DictionaryService("jdbc:sqlite:" + dir.resolve("missing.db"));

    assertThatThrownBy(dictionary::load)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void emptyDictionaryFailsStartup() throws SQLException {
    DictionaryService dictionary = new DictionaryService(createDictionary());

    assertThatThrownBy(dictionary::load)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no words");
  }

  @Test
  void closedDictionaryKnowsNoWords() throws SQLException {
    DictionaryService dictionary = new DictionaryService(createDictionary("cat"));
    dictionary.load();
    dictionary.close();

    assertThat(dictionary.isValidWord("cat")).isFalse();
  }
}
