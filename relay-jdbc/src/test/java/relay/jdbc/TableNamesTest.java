package relay.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableNamesTest {

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals(TableNames.DEFAULT_TABLE, TableNames.validate(TableNames.DEFAULT_TABLE));
    assertEquals("Destinations2", TableNames.validate("Destinations2"));
    assertEquals("_relay", TableNames.validate("_relay"));
  }

  @Test
  void rejectsAnythingThatNeedsQuoting() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("9lives"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("relay.destination"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("relay-destination"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
  }

  @Test
  void capsLengthAtPostgresIdentifierLimit() {
    String longest = "t".repeat(TableNames.MAX_LENGTH);
    assertEquals(longest, TableNames.validate(longest));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TableNames.validate(longest + "x"));
    assertTrue(ex.getMessage().contains("63"));
  }
}
