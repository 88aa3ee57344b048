package fanout;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordIdTest {

  @Test
  void ordersByTimestampThenSequence() {
    List<RecordId> ids = new ArrayList<>(List.of(
        new RecordId(20, 0), new RecordId(10, 2), new RecordId(10, 0), RecordId.ZERO));

    Collections.sort(ids);

    assertEquals(List.of(RecordId.ZERO, new RecordId(10, 0), new RecordId(10, 2), new RecordId(20, 0)), ids);
    assertTrue(new RecordId(10, 5).isBefore(new RecordId(11, 0)));
    assertFalse(new RecordId(10, 5).isBefore(new RecordId(10, 5)));
  }

  @Test
  void nextIsSmallestGreaterId() {
    assertEquals(new RecordId(10, 1), new RecordId(10, 0).next());
    assertEquals(new RecordId(11, 0), new RecordId(10, Integer.MAX_VALUE).next());
  }

  @Test
  void parsesTextForm() {
    assertEquals(new RecordId(1718000000000L, 3), RecordId.parse("1718000000000-3"));
    assertEquals(RecordId.ofMillis(42), RecordId.parse("42"));
    assertEquals("1718000000000-3", new RecordId(1718000000000L, 3).toString());
  }

  @Test
  void rejectsMalformedText() {
    assertThrows(IllegalArgumentException.class, () -> RecordId.parse("abc"));
    assertThrows(IllegalArgumentException.class, () -> RecordId.parse("1-x"));
    assertThrows(IllegalArgumentException.class, () -> RecordId.parse("-1"));
    assertThrows(NullPointerException.class, () -> RecordId.parse(null));
  }

  @Test
  void rejectsNegativeComponents() {
    assertThrows(IllegalArgumentException.class, () -> new RecordId(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> new RecordId(0, -1));
  }

  @Test
  void ofMillisZeroIsZero() {
    assertSame(RecordId.ZERO, RecordId.ofMillis(0));
    assertEquals(new RecordId(5, 0), RecordId.ofMillis(5));
  }
}
