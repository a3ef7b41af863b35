/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ilayer.rfq.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy with a fixed or jittered exponential delay between attempts.
 * <p>
 * Used for resubscribing after a substrate failure (fixed, unbounded), for offers to a back
 * pressured publication (fixed, bounded) and for rate limited price lookups (exponential with
 * jitter, bounded).
 */
public final class RetryPolicy
{
    /**
     * Backoff strategy types.
     */
    public enum BackoffStrategy
    {
        /** Fixed delay between retries */
        FIXED,
        /** Exponential with random jitter to prevent thundering herd */
        EXPONENTIAL_WITH_JITTER
    }

    /** Value of {@link #maxAttempts()} for a policy that never gives up */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final BackoffStrategy strategy;
    private final double jitterFactor;

    private RetryPolicy(
        final int maxAttempts,
        final long initialDelayMs,
        final long maxDelayMs,
        final BackoffStrategy strategy,
        final double jitterFactor)
    {
        if (maxAttempts < 1)
        {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }

        if (initialDelayMs < 0)
        {
            throw new IllegalArgumentException("delay must be >= 0: " + initialDelayMs);
        }

        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.strategy = strategy;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Create a fixed delay retry policy.
     *
     * @param maxAttempts maximum attempts including the first.
     * @param delayMs     delay between retries in milliseconds.
     * @return the retry policy
     */
    public static RetryPolicy fixed(final int maxAttempts, final long delayMs)
    {
        return new RetryPolicy(maxAttempts, delayMs, delayMs, BackoffStrategy.FIXED, 0.0);
    }

    /**
     * Create a fixed delay retry policy that never runs out of attempts.
     *
     * @param delayMs delay between retries in milliseconds.
     * @return the retry policy
     */
    public static RetryPolicy unbounded(final long delayMs)
    {
        return fixed(UNBOUNDED, delayMs);
    }

    /**
     * Create an exponential backoff with jitter retry policy.
     *
     * @param maxAttempts    maximum attempts including the first.
     * @param initialDelayMs initial delay in milliseconds
     * @param maxDelayMs     maximum delay cap in milliseconds
     * @param jitterFactor   jitter factor (0.0 to 1.0), e.g., 0.5 = ±50% randomization
     * @return the retry policy
     */
    public static RetryPolicy exponentialWithJitter(
        final int maxAttempts,
        final long initialDelayMs,
        final long maxDelayMs,
        final double jitterFactor)
    {
        return new RetryPolicy(
            maxAttempts, initialDelayMs, maxDelayMs, BackoffStrategy.EXPONENTIAL_WITH_JITTER, jitterFactor);
    }

    /**
     * Calculate the delay after the given failed attempt.
     *
     * @param attempt the attempt number (1-based)
     * @return delay in milliseconds
     */
    public long calculateDelayMs(final int attempt)
    {
        if (attempt <= 0)
        {
            return 0;
        }

        long delay;

        switch (strategy)
        {
            case EXPONENTIAL_WITH_JITTER:
                delay = initialDelayMs * (1L << Math.min(attempt - 1, 30));
                final double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
                delay = (long)(delay * jitter);
                break;

            case FIXED:
            default:
                delay = initialDelayMs;
        }

        return Math.min(delay, maxDelayMs);
    }

    /**
     * Check if retry should be attempted.
     *
     * @param attempt number of attempts made so far (1-based)
     * @return true if more retries allowed
     */
    public boolean shouldRetry(final int attempt)
    {
        return UNBOUNDED == maxAttempts || attempt < maxAttempts;
    }

    public int maxAttempts()
    {
        return maxAttempts;
    }

    public long initialDelayMs()
    {
        return initialDelayMs;
    }

    public BackoffStrategy strategy()
    {
        return strategy;
    }

    @Override
    public String toString()
    {
        return "RetryPolicy{" +
            "maxAttempts=" + (UNBOUNDED == maxAttempts ? "unbounded" : String.valueOf(maxAttempts)) +
            ", initialDelayMs=" + initialDelayMs +
            ", maxDelayMs=" + maxDelayMs +
            ", strategy=" + strategy +
            ", jitterFactor=" + jitterFactor +
            '}';
    }
}
