package dev.aahmedlab.taskpool;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScheduleThreadTest {

  private TaskPool pool;

  @BeforeEach
  void setUp() throws TaskPoolException {
    pool = TaskPoolTestSupport.createPreparedPool(2, false);
  }

  @AfterEach
  void tearDown() {
    while (pool.getScheduleThreadRefCount() > 0) {
      pool.disableScheduleThread();
    }
    pool.cleanup();
  }

  @Test
  void contextIsAbsentUntilEnabled() {
    assertTrue(pool.getScheduleContext().isEmpty());
    assertEquals(0, pool.getScheduleThreadRefCount());
  }

  @Test
  void enablingTwiceCountsReferences() {
    assertTrue(pool.enableScheduleThread());
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    assertTrue(pool.enableScheduleThread());
    assertEquals(2, pool.getScheduleThreadRefCount());
    assertSame(context, pool.getScheduleContext().orElseThrow(), "second enable reuses the context");

    assertTrue(pool.disableScheduleThread());
    assertEquals(1, pool.getScheduleThreadRefCount());
    assertTrue(pool.getScheduleContext().isPresent(), "one reference keeps the thread alive");

    assertTrue(pool.disableScheduleThread());
    assertEquals(0, pool.getScheduleThreadRefCount());
    assertTrue(pool.getScheduleContext().isEmpty());

    assertThrows(IllegalStateException.class, () -> pool.disableScheduleThread());
    assertEquals(0, pool.getScheduleThreadRefCount());
  }

  @Test
  void postedWorkRunsInOrderAndThreadStopsOnDisable() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    List<String> completed = new CopyOnWriteArrayList<>();
    AtomicReference<Thread> scheduleThread = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(1);

    assertTrue(
        context.post(
            () -> {
              scheduleThread.set(Thread.currentThread());
              TaskPoolTestSupport.sleepQuietly(50);
              completed.add("A");
            }));
    assertTrue(
        context.post(
            () -> {
              completed.add("B");
              done.countDown();
            }));

    assertTrue(done.await(1, TimeUnit.SECONDS));
    assertEquals(List.of("A", "B"), completed);

    pool.disableScheduleThread();

    assertTrue(pool.getScheduleContext().isEmpty());
    assertFalse(scheduleThread.get().isAlive(), "disable must join the schedule thread");
  }

  @Test
  void postedWorkNeverOverlaps() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    TaskPoolTestSupport.ConcurrencyTracker tracker = new TaskPoolTestSupport.ConcurrencyTracker();
    List<Integer> order = new ArrayList<>();
    int n = 200;
    CountDownLatch done = new CountDownLatch(n);

    for (int i = 0; i < n; i++) {
      int id = i;
      context.post(
          () -> {
            tracker.enter();
            try {
              order.add(id);
            } finally {
              tracker.exit();
              done.countDown();
            }
          });
    }

    assertTrue(done.await(2, TimeUnit.SECONDS));
    assertEquals(1, tracker.max());
    // Disabling joins the schedule thread, which publishes the list to this thread
    pool.disableScheduleThread();
    for (int i = 0; i < n; i++) {
      assertEquals(i, order.get(i), "Out of order at " + i);
    }
  }

  @Test
  void workRunsOnTheScheduleThreadOnly() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    AtomicBoolean inside = new AtomicBoolean();
    AtomicReference<String> threadName = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(1);

    context.post(
        () -> {
          inside.set(context.isScheduleThread());
          threadName.set(Thread.currentThread().getName());
          done.countDown();
        });

    assertTrue(done.await(1, TimeUnit.SECONDS));
    assertTrue(inside.get());
    assertFalse(context.isScheduleThread());
    assertEquals(pool.getName(), threadName.get());
  }

  @Test
  void postAfterDisableIsRefused() {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    pool.disableScheduleThread();

    AtomicBoolean ran = new AtomicBoolean();
    assertFalse(context.post(() -> ran.set(true)));
    assertFalse(ran.get());
  }

  @Test
  void failingWorkDoesNotStopTheLoop() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    CountDownLatch done = new CountDownLatch(1);

    context.post(
        () -> {
          throw new IllegalStateException("boom");
        });
    context.post(done::countDown);

    assertTrue(done.await(1, TimeUnit.SECONDS), "loop stopped after failing work");
  }

  @Test
  void reEnablingAfterTeardownStartsAFreshThread() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext first = pool.getScheduleContext().orElseThrow();
    pool.disableScheduleThread();

    pool.enableScheduleThread();
    ScheduleContext second = pool.getScheduleContext().orElseThrow();
    CountDownLatch done = new CountDownLatch(1);

    assertNotSame(first, second);
    assertTrue(second.post(done::countDown));
    assertTrue(done.await(1, TimeUnit.SECONDS));
  }

  @Test
  void concurrentEnablesShareOneThread() throws Exception {
    int callers = 8;
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    CountDownLatch go = new CountDownLatch(1);
    CountDownLatch enabled = new CountDownLatch(callers);

    for (int i = 0; i < callers; i++) {
      executor.submit(
          () -> {
            try {
              go.await();
              pool.enableScheduleThread();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              enabled.countDown();
            }
          });
    }
    go.countDown();
    assertTrue(enabled.await(2, TimeUnit.SECONDS));
    executor.shutdown();
    assertTrue(executor.awaitTermination(1, TimeUnit.SECONDS));

    assertEquals(callers, pool.getScheduleThreadRefCount());
    long scheduleThreads =
        Thread.getAllStackTraces().keySet().stream()
            .filter(t -> t.getName().equals(pool.getName()))
            .count();
    assertEquals(1, scheduleThreads);

    for (int i = 0; i < callers; i++) {
      pool.disableScheduleThread();
    }
    assertTrue(pool.getScheduleContext().isEmpty());
  }

  @Test
  void scheduleThreadCannotReleaseItsLastReference() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    AtomicReference<Throwable> error = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(1);

    context.post(
        () -> {
          try {
            pool.disableScheduleThread();
          } catch (Throwable t) {
            error.set(t);
          } finally {
            done.countDown();
          }
        });

    assertTrue(done.await(1, TimeUnit.SECONDS));
    assertInstanceOf(IllegalStateException.class, error.get());
    assertEquals(1, pool.getScheduleThreadRefCount());
  }

  @Test
  void workOnAStoppingThreadCanEnableAFreshOne() throws Exception {
    pool.enableScheduleThread();
    ScheduleContext context = pool.getScheduleContext().orElseThrow();
    CountDownLatch started = new CountDownLatch(1);
    AtomicReference<Throwable> error = new AtomicReference<>();

    context.post(
        () -> {
          started.countDown();
          // Let the disable below begin waiting for this thread
          TaskPoolTestSupport.sleepQuietly(100);
          try {
            pool.enableScheduleThread();
            pool.disableScheduleThread();
          } catch (Throwable t) {
            error.set(t);
          }
        });
    assertTrue(started.await(1, TimeUnit.SECONDS));

    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> pool.disableScheduleThread());
    assertNull(error.get());
    assertEquals(0, pool.getScheduleThreadRefCount());
    assertTrue(pool.getScheduleContext().isEmpty());
  }

  @Test
  void scheduleThreadIsIndependentOfTheWorkerBackend() throws Exception {
    TaskPool unprepared = TaskPool.create();
    try {
      assertTrue(unprepared.enableScheduleThread());
      CountDownLatch done = new CountDownLatch(1);
      unprepared.getScheduleContext().orElseThrow().post(done::countDown);
      assertTrue(done.await(1, TimeUnit.SECONDS));
    } finally {
      unprepared.disableScheduleThread();
    }
  }
}
