package com.atasa.audio.processor.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Executor that holds submitted tasks until the test runs them.
 *
 * <p>Lets a test observe the state between accepting a request and doing its work.
 */
public class CapturingExecutor implements Executor {

  private final List<Runnable> pending = new ArrayList<>();

  @Override
  public void execute(Runnable command) {
    pending.add(command);
  }

  public int pendingCount() {
    return pending.size();
  }

  /** Run and discard every pending task in submission order. */
  public void runAll() {
    List<Runnable> tasks = new ArrayList<>(pending);
    pending.clear();
    tasks.forEach(Runnable::run);
  }
}
