package io.intellixity.tally.util;

import io.intellixity.tally.error.QueryCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation signal for long-running discovery or query execution.\n
 *
 * Executors register a callback (typically {@code Statement::cancel}) for the duration of each
 * in-flight statement; {@link #cancel()} fires every registered callback once.\n
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /** Callback registration; closing it detaches the callback. */
  public interface Registration extends AutoCloseable {
    @Override void close();
  }

  public static CancellationToken create() { return new CancellationToken(); }

  public boolean isCancelled() { return cancelled.get(); }

  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) return;
    for (Runnable r : callbacks) r.run();
  }

  /** Runs {@code callback} on cancellation, or immediately if already cancelled. */
  public Registration onCancel(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) callback.run();
    return () -> callbacks.remove(callback);
  }

  public void throwIfCancelled(String operation) {
    if (cancelled.get()) throw new QueryCancelledException(operation + " was cancelled", null);
  }
}
