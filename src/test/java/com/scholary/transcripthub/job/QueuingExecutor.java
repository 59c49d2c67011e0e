package com.scholary.transcripthub.job;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/** Holds submitted tasks until the test runs them; can simulate a full queue. */
class QueuingExecutor implements Executor {

  private final Deque<Runnable> tasks = new ConcurrentLinkedDeque<>();
  private volatile boolean rejecting;

  @Override
  public void execute(Runnable task) {
    if (rejecting) {
      throw new RejectedExecutionException("queue full");
    }
    tasks.add(task);
  }

  void reject() {
    rejecting = true;
  }

  int pending() {
    return tasks.size();
  }

  void runAll() {
    Runnable task;
    while ((task = tasks.poll()) != null) {
      task.run();
    }
  }
}
