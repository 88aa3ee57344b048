package fanout.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("fanout-test-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertEquals("fanout-test-1", first.getName());
    assertEquals("fanout-test-2", second.getName());
    assertTrue(first.isDaemon());
    assertNotNull(first.getUncaughtExceptionHandler());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
