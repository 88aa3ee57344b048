package fanout.sink;

import fanout.Record;
import fanout.RecordId;
import fanout.SinkSaturatedException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SinkTest {

  private static Record record(long ms) {
    return new Record("k1", RecordId.ofMillis(ms), ("r" + ms).getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void deliversInOfferOrder() throws Exception {
    Sink sink = new Sink("k1", 10, OverflowPolicy.DISCONNECT);

    assertEquals(OfferResult.ACCEPTED, sink.offer(record(1)));
    assertEquals(OfferResult.ACCEPTED, sink.offer(record(2)));

    assertEquals(record(1), sink.poll(Duration.ZERO));
    assertEquals(record(2), sink.poll(Duration.ZERO));
    assertNull(sink.poll(Duration.ofMillis(10)));
    assertFalse(sink.isDrained());
    assertEquals(2, sink.acceptedCount());
  }

  @Test
  void rejectsRecordsNotNewerThanLastAccepted() {
    Sink sink = new Sink("k1", 10, OverflowPolicy.DISCONNECT);
    sink.offer(record(5));

    assertEquals(OfferResult.DUPLICATE, sink.offer(record(5)));
    assertEquals(OfferResult.DUPLICATE, sink.offer(record(3)));
    assertEquals(1, sink.size());
  }

  @Test
  void dropOldestKeepsNewest() throws Exception {
    Sink sink = new Sink("k1", 2, OverflowPolicy.DROP_OLDEST);
    sink.offer(record(1));
    sink.offer(record(2));

    assertEquals(OfferResult.ACCEPTED_DROPPED_OLDEST, sink.offer(record(3)));

    assertEquals(record(2), sink.poll(Duration.ZERO));
    assertEquals(record(3), sink.poll(Duration.ZERO));
    assertEquals(1, sink.droppedCount());
  }

  @Test
  void dropNewestKeepsQueue() throws Exception {
    Sink sink = new Sink("k1", 2, OverflowPolicy.DROP_NEWEST);
    sink.offer(record(1));
    sink.offer(record(2));

    assertEquals(OfferResult.DROPPED, sink.offer(record(3)));

    assertEquals(record(1), sink.poll(Duration.ZERO));
    assertEquals(record(2), sink.poll(Duration.ZERO));
    assertEquals(1, sink.droppedCount());
    assertFalse(sink.isClosed());
  }

  @Test
  void disconnectFailsSinkWhenFull() throws Exception {
    Sink sink = new Sink("k1", 1, OverflowPolicy.DISCONNECT);
    sink.offer(record(1));

    assertEquals(OfferResult.SATURATED, sink.offer(record(2)));

    assertTrue(sink.isClosed());
    assertEquals(CloseReason.FAILED, sink.closeReason());
    SinkSaturatedException error = assertInstanceOf(SinkSaturatedException.class, sink.failure());
    assertEquals(1, error.capacity());
    // queued record still handed out
    assertEquals(record(1), sink.poll(Duration.ZERO));
    assertTrue(sink.isDrained());
    assertEquals(OfferResult.CLOSED, sink.offer(record(3)));
  }

  @Test
  void terminatesExactlyOnce() {
    Sink sink = new Sink("k1", 4, OverflowPolicy.DISCONNECT);

    assertTrue(sink.complete(CloseReason.CANCELLED));
    assertFalse(sink.complete(CloseReason.SHUTDOWN));
    assertFalse(sink.fail(new IllegalStateException("late")));

    assertEquals(CloseReason.CANCELLED, sink.closeReason());
    assertNull(sink.failure());
  }

  @Test
  void completeRejectsFailedReason() {
    Sink sink = new Sink("k1", 4, OverflowPolicy.DISCONNECT);

    assertThrows(IllegalArgumentException.class, () -> sink.complete(CloseReason.FAILED));
    assertFalse(sink.isClosed());
  }

  @Test
  void takeReturnsNullWhenCompletedWhileWaiting() throws Exception {
    Sink sink = new Sink("k1", 4, OverflowPolicy.DISCONNECT);
    CompletableFuture<Record> taken = CompletableFuture.supplyAsync(() -> {
      try {
        return sink.take();
      } catch (InterruptedException e) {
        throw new IllegalStateException(e);
      }
    });

    Thread.sleep(50);
    sink.complete(CloseReason.SHUTDOWN);

    assertNull(taken.get(5, TimeUnit.SECONDS));
    assertTrue(sink.isDrained());
  }

  @Test
  void takeWakesOnOffer() throws Exception {
    Sink sink = new Sink("k1", 4, OverflowPolicy.DISCONNECT);
    CompletableFuture<Record> taken = CompletableFuture.supplyAsync(() -> {
      try {
        return sink.take();
      } catch (InterruptedException e) {
        throw new IllegalStateException(e);
      }
    });

    sink.offer(record(7));

    assertEquals(record(7), taken.get(5, TimeUnit.SECONDS));
  }

  @Test
  void idsAreUnique() {
    Sink a = new Sink("k1", 1, OverflowPolicy.DISCONNECT);
    Sink b = new Sink("k1", 1, OverflowPolicy.DISCONNECT);

    assertNotEquals(a.id(), b.id());
    assertEquals(26, a.id().length());
  }

  @Test
  void validatesArguments() {
    assertThrows(IllegalArgumentException.class, () -> new Sink("k1", 0, OverflowPolicy.DISCONNECT));
    assertThrows(NullPointerException.class, () -> new Sink("k1", 1, null));
    assertThrows(IllegalArgumentException.class, () -> new Sink("", 1, OverflowPolicy.DISCONNECT));
  }
}
