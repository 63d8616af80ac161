package supportbus.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void plainIdentifiersAreAccepted() {
    assertEquals("completed_conversations", TableNames.validate("completed_conversations"));
    assertEquals("_archive2", TableNames.validate("_archive2"));
  }

  @Test
  void defaults() {
    assertEquals("completed_conversations", TableNames.DEFAULT_CONVERSATIONS_TABLE);
    assertEquals("completed_messages", TableNames.DEFAULT_MESSAGES_TABLE);
  }

  @Test
  void nullTableNameThrows() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void unsafeNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("9lives"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("messages; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("audit.messages"));
  }
}
