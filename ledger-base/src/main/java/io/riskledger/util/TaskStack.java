/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.util;


import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A stack of close-tasks executed in LIFO order on {@linkplain #close()}.
 * Mostly used in try-with-resources blocks as a close-on-failure guard:
 * resources are pushed as they're acquired and the stack is
 * {@linkplain #clear() cleared} once construction succeeds.
 *
 * <p>
 * Errors thrown by individual tasks on closing are logged, not propagated,
 * so that every task gets a chance to run.
 * </p>
 */
public class TaskStack implements AutoCloseable {

  private final static String LOG_NAME = "riskledger.util";

  private final Deque<AutoCloseable> tasks = new ArrayDeque<>();


  /**
   * Pushes the given closeable and returns it.
   *
   * @return {@code closeable}
   */
  public <T extends AutoCloseable> T push(T closeable) {
    tasks.push(Objects.requireNonNull(closeable, "null closeable"));
    return closeable;
  }


  /**
   * Pushes the given closeables (in order). Null arguments are ignored.
   *
   * @return {@code this}
   */
  public TaskStack pushClose(AutoCloseable... closeables) {
    for (var c : closeables)
      if (c != null)
        tasks.push(c);
    return this;
  }


  /**
   * Pushes the given runnable as a close-task.
   *
   * @return {@code this}
   */
  public TaskStack pushRun(Runnable task) {
    Objects.requireNonNull(task, "null task");
    tasks.push(task::run);
    return this;
  }


  /**
   * Pops and closes the last pushed task, if any.
   *
   * @return {@code false} if the stack was empty
   */
  public boolean pop() {
    var task = tasks.poll();
    if (task == null)
      return false;
    closeQuietly(task);
    return true;
  }


  /** Discards all tasks without running them. */
  public void clear() {
    tasks.clear();
  }


  /** Returns the number of pending tasks. */
  public int size() {
    return tasks.size();
  }


  /** Runs (closes) all pending tasks in LIFO order. */
  @Override
  public void close() {
    while (!tasks.isEmpty())
      closeQuietly(tasks.pop());
  }


  private void closeQuietly(AutoCloseable task) {
    try {
      task.close();
    } catch (Exception x) {
      System.getLogger(LOG_NAME).log(
          Level.WARNING, "ignoring error on closing %s: %s".formatted(task, x));
    }
  }

}
