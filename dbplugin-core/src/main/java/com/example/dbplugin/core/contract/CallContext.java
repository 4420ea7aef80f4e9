package com.example.dbplugin.core.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline signal that accompanies every call from the host.
 *
 * <p>A context is cancelled either explicitly through {@link #cancel()} or implicitly once its
 * deadline has passed. Components doing blocking work register hooks with {@link #onCancel} so an
 * in-flight backend call can be interrupted when {@link #cancel()} fires.
 *
 * <pre>{@code
 * var ctx = CallContext.withTimeout(Duration.ofSeconds(5));
 * db.deleteUser(ctx, new DeleteUserRequest("v-token-ro-abc12345", Statements.empty()));
 * }</pre>
 */
public final class CallContext {

  private static final Clock SYSTEM_CLOCK = Clock.systemUTC();

  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

  private CallContext(final Instant deadline, final Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  /**
   * Context with no deadline that is only cancelled explicitly.
   *
   * @return new context
   */
  public static CallContext background() {
    return new CallContext(null, SYSTEM_CLOCK);
  }

  public static CallContext withTimeout(final Duration timeout) {
    return withDeadline(SYSTEM_CLOCK.instant().plus(timeout));
  }

  public static CallContext withDeadline(final Instant deadline) {
    return withDeadline(deadline, SYSTEM_CLOCK);
  }

  static CallContext withDeadline(final Instant deadline, final Clock clock) {
    if (deadline == null) throw new IllegalArgumentException("deadline cannot be null");
    return new CallContext(deadline, clock);
  }

  /** Cancels the context and runs registered hooks once. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) return;
    for (final var hook : hooks) if (hooks.remove(hook)) hook.run();
  }

  /**
   * Whether the context was cancelled or its deadline has passed.
   *
   * @return true once the caller is no longer interested in the result
   */
  public boolean isCancelled() {
    return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * Time left until the deadline, never negative.
   *
   * @return remaining time, or empty when there is no deadline
   */
  public Optional<Duration> remaining() {
    return deadline()
        .map(d -> Duration.between(clock.instant(), d))
        .map(d -> d.isNegative() ? Duration.ZERO : d);
  }

  /**
   * Registers a hook that runs when {@link #cancel()} is called. If the context is already
   * cancelled the hook runs immediately.
   *
   * @param hook action to run on cancellation
   * @return registration; closing it removes the hook
   */
  public Registration onCancel(final Runnable hook) {
    hooks.add(hook);
    if (cancelled.get() && hooks.remove(hook)) hook.run();
    return () -> hooks.remove(hook);
  }

  /** Handle returned by {@link #onCancel}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
