/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MainThreadTest {

  @Test
  void tasksRunOnlyWhenPumped() {
    MainThread mailbox = new MainThread();
    List<String> ran = new ArrayList<>();

    mailbox.execute(() -> ran.add("a"));
    mailbox.execute(() -> ran.add("b"));

    assertEquals(List.of(), ran);
    assertEquals(2, mailbox.pending());
    assertEquals(2, mailbox.runPending());
    assertEquals(List.of("a", "b"), ran);
  }

  @Test
  void tasksPostedWhilePumpingWaitForTheNextTick() {
    MainThread mailbox = new MainThread();
    List<String> ran = new ArrayList<>();

    mailbox.execute(
        () -> {
          ran.add("first");
          mailbox.execute(() -> ran.add("second"));
        });

    assertEquals(1, mailbox.runPending());
    assertEquals(List.of("first"), ran);
    assertEquals(1, mailbox.runPending());
    assertEquals(List.of("first", "second"), ran);
  }

  @Test
  void drainAllRunsNestedTasks() {
    MainThread mailbox = new MainThread();
    List<String> ran = new ArrayList<>();
    mailbox.execute(
        () -> {
          ran.add("first");
          mailbox.execute(() -> ran.add("second"));
        });

    assertEquals(2, mailbox.drainAll());
    assertEquals(0, mailbox.pending());
  }

  @Test
  void failingTaskDoesNotStopTheOthers() {
    MainThread mailbox = new MainThread();
    List<String> ran = new ArrayList<>();
    mailbox.execute(
        () -> {
          throw new IllegalStateException("boom");
        });
    mailbox.execute(() -> ran.add("after"));

    assertEquals(2, mailbox.runPending());
    assertEquals(List.of("after"), ran);
  }
}
