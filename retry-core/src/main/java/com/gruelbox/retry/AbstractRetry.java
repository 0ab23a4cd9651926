package com.gruelbox.retry;

import static com.gruelbox.retry.spi.Utils.logAtLevel;

import com.gruelbox.retry.spi.RetryConfig;
import com.gruelbox.retry.spi.Utils;
import java.time.Duration;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

/**
 * Settings shared by all retry drivers. Each call to a driver starts a new, independent session
 * using these settings, with a fresh {@link Backoff}. Drivers may be called concurrently but should
 * not be reconfigured while in use.
 *
 * @param <S> The type of sleeper the driver uses between attempts.
 * @param <SELF> The driver type, for chaining.
 */
@Slf4j
public abstract class AbstractRetry<S, SELF extends AbstractRetry<S, SELF>>
    implements Validatable {

  protected BackoffBuilder backoff;
  protected S sleeper;
  protected Predicate<? super Exception> retryable;
  protected RetryNotifier notifier;
  protected DelayAdjuster adjuster;
  protected Level logLevelTemporaryFailure;
  protected String name;

  protected AbstractRetry() {}

  /**
   * @param backoff Creates the delays between attempts. Defaults to {@link
   *     BackoffBuilder#exponential()}.
   * @return This driver.
   */
  public SELF backoff(BackoffBuilder backoff) {
    this.backoff = backoff;
    return self();
  }

  /**
   * @param sleeper Waits between attempts. Defaults to a sleeper appropriate to the driver.
   * @return This driver.
   */
  public SELF sleeper(S sleeper) {
    this.sleeper = sleeper;
    return self();
  }

  /**
   * @param retryable Decides which errors are worth retrying. Errors it rejects are surfaced
   *     immediately, without consulting the backoff. Defaults to retrying all errors.
   * @return This driver.
   */
  public SELF when(Predicate<? super Exception> retryable) {
    this.retryable = retryable;
    return self();
  }

  /**
   * @param notifier Notified before each retry. Defaults to {@link RetryNotifier#EMPTY}.
   * @return This driver.
   */
  public SELF notifier(RetryNotifier notifier) {
    this.notifier = notifier;
    return self();
  }

  /**
   * @param logLevelTemporaryFailure The log level to use when logging failed attempts which will be
   *     retried. Includes a full stack trace. Defaults to {@code DEBUG}.
   * @return This driver.
   */
  public SELF logLevelTemporaryFailure(Level logLevelTemporaryFailure) {
    this.logLevelTemporaryFailure = logLevelTemporaryFailure;
    return self();
  }

  /**
   * @param name A name for the operation, used in log messages. Defaults to {@code "operation"}.
   * @return This driver.
   */
  public SELF name(String name) {
    this.name = name;
    return self();
  }

  @SuppressWarnings("unchecked")
  protected final SELF self() {
    return (SELF) this;
  }

  /**
   * @return The sleeper to use if none is configured.
   */
  protected abstract S defaultSleeper();

  @Override
  public void validate(Validator validator) {
    if (backoff != null) {
      validator.valid("backoff", backoff);
    }
  }

  /**
   * Validates the settings and creates the state for a new session.
   *
   * @return The session state.
   * @throws IllegalArgumentException If the settings are invalid.
   */
  protected final RetryConfig<S> newSession() {
    new Validator().validate(this);
    return new RetryConfig<>(
        Utils.firstNonNull(backoff, BackoffBuilder::exponential).build(),
        Utils.firstNonNull(sleeper, this::defaultSleeper),
        Utils.firstNonNull(retryable, () -> error -> true),
        Utils.firstNonNull(notifier, () -> RetryNotifier.EMPTY),
        Utils.firstNonNull(adjuster, () -> DelayAdjuster.IDENTITY));
  }

  protected final void logRetrying(int attempt, Exception error, Duration delay) {
    logAtLevel(
        log,
        level(),
        "Attempt {} of {} failed. Retrying in {}",
        attempt,
        operationName(),
        delay,
        error);
  }

  protected final void logGivingUp(int attempt, Exception error) {
    log.debug(
        "Attempt {} of {} failed and will not be retried: {}",
        attempt,
        operationName(),
        error.toString());
  }

  protected final void logSucceeded(int attempt) {
    if (attempt > 1) {
      log.debug("{} succeeded on attempt {}", operationName(), attempt);
    }
  }

  protected final void logInterrupted(int attempt) {
    log.debug("Interrupted waiting to retry {} after attempt {}", operationName(), attempt);
  }

  private Level level() {
    return logLevelTemporaryFailure == null ? Level.DEBUG : logLevelTemporaryFailure;
  }

  private String operationName() {
    return name == null ? "operation" : name;
  }
}
