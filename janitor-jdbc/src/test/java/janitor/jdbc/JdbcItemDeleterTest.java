package janitor.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcItemDeleterTest {

  private H2Fixture db;

  @BeforeEach
  void setUp() throws SQLException {
    db = new H2Fixture();
    JdbcPartitionStoreTest.thread(db, 1, "tech", 1, false);
    JdbcPartitionStoreTest.thread(db, 2, "tech", 2, false);
    db.execute(
        "INSERT INTO posts (thread_id, body) VALUES (1, 'op')",
        "INSERT INTO posts (thread_id, body) VALUES (1, 'reply')",
        "INSERT INTO posts (thread_id, body) VALUES (2, 'other')");
  }

  @Test
  void deletesItemAndDependentsTogether() throws Exception {
    JdbcItemDeleter deleter = JdbcItemDeleter.builder()
        .connectionProvider(db.connections)
        .dependent("posts", "thread_id")
        .build();

    deleter.delete("tech", 1);

    assertEquals(1, db.count("SELECT COUNT(*) FROM threads"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM posts WHERE thread_id = 1"));
    assertEquals(1, db.count("SELECT COUNT(*) FROM posts WHERE thread_id = 2"));
  }

  @Test
  void itemInOtherPartitionIsNotDeleted() throws Exception {
    JdbcItemDeleter deleter = JdbcItemDeleter.builder()
        .connectionProvider(db.connections)
        .build();

    deleter.delete("b", 1);

    assertEquals(2, db.count("SELECT COUNT(*) FROM threads"));
  }

  @Test
  void failureRollsBackDependentDeletes() {
    JdbcItemDeleter deleter = JdbcItemDeleter.builder()
        .connectionProvider(db.connections)
        .dependent("posts", "thread_id")
        .dependent("missing_table", "thread_id")
        .build();

    assertThrows(JanitorStoreException.class, () -> deleter.delete("tech", 1));

    assertDoesNotThrow(() -> {
      assertEquals(2, db.count("SELECT COUNT(*) FROM posts WHERE thread_id = 1"));
      assertEquals(2, db.count("SELECT COUNT(*) FROM threads"));
    });
  }
}
