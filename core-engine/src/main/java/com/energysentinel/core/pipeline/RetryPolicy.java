package com.energysentinel.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-schedule retry of external calls.
 *
 * <p>
 * After the first failed attempt the call is retried once per configured
 * delay (by default 60 s, 300 s and 900 s). Failures the predicate does not
 * accept are rethrown immediately; once the schedule is exhausted the last
 * failure is rethrown.
 * </p>
 *
 * @since 1.0.0
 */
public class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    private final List<Duration> delays;
    private final Sleeper sleeper;

    public RetryPolicy(List<Duration> delays, Sleeper sleeper) {
        this.delays = List.copyOf(Objects.requireNonNull(delays, "delays must not be null"));
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static RetryPolicy ofSeconds(List<Integer> delaysSeconds, Sleeper sleeper) {
        return new RetryPolicy(delaysSeconds.stream().map(Duration::ofSeconds).toList(), sleeper);
    }

    /**
     * @param operation name used in log messages
     * @param action    the call to attempt
     * @param retryable decides whether a failure is worth another attempt
     * @return the first successful result
     */
    public <T> T execute(String operation, Supplier<T> action, Predicate<RuntimeException> retryable) {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(retryable, "retryable must not be null");
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e) || attempt >= delays.size()) {
                    if (attempt > 0) {
                        LOG.error("{} failed after {} attempt(s): {}", operation, attempt + 1, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = delays.get(attempt);
                attempt++;
                LOG.warn("{} failed (attempt {}), retrying in {} s: {}",
                        operation, attempt, delay.toSeconds(), e.getMessage());
                pause(delay, e);
            }
        }
    }

    public void run(String operation, Runnable action, Predicate<RuntimeException> retryable) {
        execute(operation, () -> {
            action.run();
            return null;
        }, retryable);
    }

    public List<Duration> getDelays() {
        return delays;
    }

    private void pause(Duration delay, RuntimeException pending) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }
}
