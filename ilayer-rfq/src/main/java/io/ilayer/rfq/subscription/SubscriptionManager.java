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
package io.ilayer.rfq.subscription;

import io.ilayer.rfq.resilience.RetryPolicy;
import io.ilayer.rfq.transport.MessagingSubstrate;
import io.ilayer.rfq.transport.SubscribeException;
import io.ilayer.rfq.transport.TopicListener;
import io.ilayer.rfq.transport.TopicSubscription;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps trying to subscribe to one content topic until it succeeds.
 * <p>
 * A failed attempt leaves the manager {@link State#UNSUBSCRIBED} and schedules the next one on the
 * supplied {@link ScheduledExecutorService} after {@link RetryPolicy#calculateDelayMs(int)}. Once
 * subscribed it stays subscribed: errors raised by the listener are the substrate's concern and
 * never trigger an unsubscribe or a second subscription.
 * <p>
 * <b>Thread Safety:</b> all state changes happen under the manager's monitor, so a retry firing
 * concurrently with {@link #close()} cannot leave a live subscription behind.
 */
public final class SubscriptionManager implements AutoCloseable
{
    /**
     * Subscription state.
     */
    public enum State
    {
        /** No live subscription, possibly with a retry pending */
        UNSUBSCRIBED,
        /** Listener registered with the substrate */
        SUBSCRIBED
    }

    private final String name;
    private final MessagingSubstrate substrate;
    private final String topic;
    private final TopicListener listener;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final CountDownLatch subscribedLatch = new CountDownLatch(1);
    private final AtomicLong retryCount = new AtomicLong();

    private State state = State.UNSUBSCRIBED;
    private TopicSubscription handle;
    private ScheduledFuture<?> pendingRetry;
    private int attempts;
    private boolean started;
    private boolean closed;

    /**
     * @param name        component name used in log lines.
     * @param substrate   substrate to subscribe on.
     * @param topic       content topic.
     * @param listener    callback for each message.
     * @param retryPolicy delay between attempts and when to give up.
     * @param scheduler   runs retries, owned by the caller.
     */
    public SubscriptionManager(
        final String name,
        final MessagingSubstrate substrate,
        final String topic,
        final TopicListener listener,
        final RetryPolicy retryPolicy,
        final ScheduledExecutorService scheduler)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.substrate = Objects.requireNonNull(substrate, "substrate");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Make the first attempt. Later attempts, if any, run on the scheduler.
     *
     * @throws IllegalStateException if already started or closed.
     */
    public synchronized void start()
    {
        if (closed)
        {
            throw new IllegalStateException(name + " subscription manager is closed");
        }

        if (started)
        {
            throw new IllegalStateException(name + " subscription manager already started");
        }

        started = true;
        attempt();
    }

    /**
     * Wait until the subscription is live.
     *
     * @param timeout how long to wait.
     * @param unit    unit of the timeout.
     * @return true if subscribed, false on timeout.
     * @throws InterruptedException if interrupted while waiting.
     */
    public boolean awaitSubscribed(final long timeout, final TimeUnit unit) throws InterruptedException
    {
        return subscribedLatch.await(timeout, unit);
    }

    public synchronized State state()
    {
        return state;
    }

    public String topic()
    {
        return topic;
    }

    /**
     * Number of failed attempts that were followed by a scheduled retry.
     *
     * @return retries scheduled so far.
     */
    public long retryCount()
    {
        return retryCount.get();
    }

    /**
     * Cancel any pending retry and close the live subscription, if there is one.
     */
    @Override
    public synchronized void close()
    {
        if (closed)
        {
            return;
        }

        closed = true;

        if (null != pendingRetry)
        {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }

        if (null != handle)
        {
            handle.close();
            handle = null;
        }

        state = State.UNSUBSCRIBED;
    }

    private synchronized void attempt()
    {
        pendingRetry = null;
        if (closed || State.SUBSCRIBED == state)
        {
            return;
        }

        attempts++;
        try
        {
            handle = substrate.subscribe(topic, listener);
            state = State.SUBSCRIBED;
            subscribedLatch.countDown();
            System.out.println("[" + name + "] Subscribed to " + topic + " after " + attempts + " attempt(s)");
        }
        catch (final SubscribeException ex)
        {
            if (!retryPolicy.shouldRetry(attempts))
            {
                System.err.println("[" + name + "] Giving up on " + topic + " after " + attempts + " attempts: " +
                    ex.getMessage());
                return;
            }

            final long delayMs = retryPolicy.calculateDelayMs(attempts);
            retryCount.incrementAndGet();
            System.err.println("[" + name + "] Subscription retry... in " + delayMs + "ms (attempt " + attempts +
                " failed: " + ex.getMessage() + ")");
            pendingRetry = scheduler.schedule(this::attempt, delayMs, TimeUnit.MILLISECONDS);
        }
    }
}
