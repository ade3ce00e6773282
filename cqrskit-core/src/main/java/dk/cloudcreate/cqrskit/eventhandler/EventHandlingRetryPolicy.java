package dk.cloudcreate.cqrskit.eventhandler;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Controls how often, and with which delay, the {@link EventHandlingProcessor} retries an event that an event handler failed to handle.<br>
 * After {@link #maximumNumberOfAttempts} failed attempts the event is skipped and the processing progress moves past it.
 */
public class EventHandlingRetryPolicy {
    public static final int      DEFAULT_MAXIMUM_NUMBER_OF_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_RETRY_DELAY        = Duration.ofMillis(1000);

    public final Duration initialRetryDelay;
    public final double   retryDelayMultiplier;
    public final int      maximumNumberOfAttempts;

    public EventHandlingRetryPolicy(Duration initialRetryDelay,
                                    double retryDelayMultiplier,
                                    int maximumNumberOfAttempts) {
        this.initialRetryDelay = requireNonNull(initialRetryDelay, "You must specify an initialRetryDelay");
        requireTrue(retryDelayMultiplier >= 1.0d, "retryDelayMultiplier must be 1.0 or larger");
        requireTrue(maximumNumberOfAttempts >= 1, "maximumNumberOfAttempts must be 1 or larger");
        this.retryDelayMultiplier = retryDelayMultiplier;
        this.maximumNumberOfAttempts = maximumNumberOfAttempts;
    }

    /**
     * @param failedAttempt the number of the attempt that just failed (1 for the first attempt)
     * @return the delay before the next attempt: <code>initialRetryDelay * retryDelayMultiplier^(failedAttempt - 1)</code>
     */
    public Duration calculateRetryDelay(int failedAttempt) {
        requireTrue(failedAttempt >= 1, "failedAttempt must be 1 or larger");
        return Duration.ofMillis((long) (initialRetryDelay.toMillis() * Math.pow(retryDelayMultiplier, failedAttempt - 1)));
    }

    public static EventHandlingRetryPolicy defaultPolicy() {
        return exponentialBackoff(DEFAULT_INITIAL_RETRY_DELAY, DEFAULT_MAXIMUM_NUMBER_OF_ATTEMPTS);
    }

    public static EventHandlingRetryPolicy fixedBackoff(Duration retryDelay,
                                                        int maximumNumberOfAttempts) {
        return new EventHandlingRetryPolicy(retryDelay, 1.0d, maximumNumberOfAttempts);
    }

    /**
     * The retry delay doubles after every failed attempt
     */
    public static EventHandlingRetryPolicy exponentialBackoff(Duration initialRetryDelay,
                                                              int maximumNumberOfAttempts) {
        return new EventHandlingRetryPolicy(initialRetryDelay, 2.0d, maximumNumberOfAttempts);
    }

    @Override
    public String toString() {
        return "EventHandlingRetryPolicy{" +
                "initialRetryDelay=" + initialRetryDelay +
                ", retryDelayMultiplier=" + retryDelayMultiplier +
                ", maximumNumberOfAttempts=" + maximumNumberOfAttempts +
                '}';
    }
}
