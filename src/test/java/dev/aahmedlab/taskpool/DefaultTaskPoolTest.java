package dev.aahmedlab.taskpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DefaultTaskPoolTest {

  @Test
  void returnsSameInstanceFromManyThreads() throws Exception {
    int callers = 8;
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<TaskPool>> results = new ArrayList<>();

    Callable<TaskPool> access =
        () -> {
          go.await();
          return TaskPool.getDefault();
        };
    for (int i = 0; i < callers; i++) {
      results.add(executor.submit(access));
    }
    go.countDown();

    TaskPool expected = TaskPool.getDefault();
    for (Future<TaskPool> result : results) {
      assertSame(expected, result.get(1, TimeUnit.SECONDS));
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(1, TimeUnit.SECONDS));
  }

  @Test
  void isPreparedOnFirstAccess() throws Exception {
    TaskPool pool = TaskPool.getDefault();
    CountDownLatch done = new CountDownLatch(1);

    assertTrue(pool.isDefault());
    assertTrue(pool.isPrepared());
    pool.push(done::countDown);

    assertTrue(done.await(1, TimeUnit.SECONDS));
  }

  @Test
  void rejectsScheduleThread() {
    TaskPool pool = TaskPool.getDefault();

    assertFalse(pool.enableScheduleThread());
    assertFalse(pool.disableScheduleThread());
    assertTrue(pool.getScheduleContext().isEmpty());
    assertEquals(0, pool.getScheduleThreadRefCount());
  }

  @Test
  void ignoresCleanupAndSecondPrepare() throws Exception {
    TaskPool pool = TaskPool.getDefault();

    pool.cleanup();
    pool.prepare();

    assertTrue(pool.isPrepared(), "the default pool is never torn down");
    CountDownLatch done = new CountDownLatch(1);
    pool.push(done::countDown);
    assertTrue(done.await(1, TimeUnit.SECONDS));
  }

  @Test
  void ordinaryPoolsAreNotTheDefault() {
    TaskPool pool = TaskPool.create();

    assertFalse(pool.isDefault());
    assertNotSame(TaskPool.getDefault(), pool);
  }
}
