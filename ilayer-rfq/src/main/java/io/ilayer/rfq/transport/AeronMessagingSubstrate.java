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
package io.ilayer.rfq.transport;

import io.aeron.Aeron;
import io.aeron.FragmentAssembler;
import io.aeron.Publication;
import io.aeron.Subscription;
import io.aeron.exceptions.AeronException;
import io.aeron.logbuffer.Header;
import io.ilayer.rfq.resilience.RetryPolicy;
import org.agrona.CloseHelper;
import org.agrona.DirectBuffer;
import org.agrona.ErrorHandler;
import org.agrona.ExpandableArrayBuffer;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.SleepingMillisIdleStrategy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MessagingSubstrate} over a single Aeron channel and stream shared by all content topics.
 * <p>
 * <b>Receiving:</b> the first {@link #subscribe(String, TopicListener)} or {@link #waitForPeers(long)}
 * adds the shared Aeron {@link Subscription} and starts an {@link AgentRunner} thread that polls it
 * through a {@link FragmentAssembler}. Each message is unwrapped with a {@link TopicEnvelope} and
 * handed to the listeners registered for its topic. Listener failures go to the
 * {@link ErrorHandler} and polling carries on.
 * <p>
 * <b>Peers:</b> {@link #waitForPeers(long)} joins the shared channel and then waits for a probe
 * publication to connect. The substrate's own subscription counts as a peer, so a successful wait
 * proves the media driver path is up, not that a remote process is listening.
 * <p>
 * <b>Publishing:</b> one-shot. Each call adds a publication, waits for it to connect, offers the
 * enveloped message with a bounded {@link RetryPolicy} on back pressure and closes the publication.
 * <p>
 * <b>Thread Safety:</b> {@link #publish} and {@link #subscribe} may be called from any thread.
 */
public final class AeronMessagingSubstrate implements MessagingSubstrate
{
    /** Maximum fragments handled per poll */
    public static final int FRAGMENT_LIMIT = 16;

    /** Default policy for offers that meet back pressure */
    public static final RetryPolicy DEFAULT_OFFER_POLICY = RetryPolicy.fixed(100, 1);

    private final Aeron aeron;
    private final String channel;
    private final int streamId;
    private final long connectTimeoutMs;
    private final RetryPolicy offerPolicy;
    private final ErrorHandler errorHandler;
    private final Map<String, List<Registration>> listenersByTopic = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong messagesPublished = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong messagesDelivered = new AtomicLong();
    private final AtomicLong invalidEnvelopes = new AtomicLong();
    private final AtomicLong listenerErrors = new AtomicLong();

    private Subscription subscription;
    private AgentRunner pollerRunner;

    /**
     * Create a substrate over an already connected Aeron client. The client is not closed by
     * {@link #close()}.
     *
     * @param aeron            connected client.
     * @param channel          shared channel URI.
     * @param streamId         shared stream ID.
     * @param connectTimeoutMs how long a publication may take to connect.
     * @param offerPolicy      retries on back pressure.
     * @param errorHandler     receives listener and poller failures.
     */
    public AeronMessagingSubstrate(
        final Aeron aeron,
        final String channel,
        final int streamId,
        final long connectTimeoutMs,
        final RetryPolicy offerPolicy,
        final ErrorHandler errorHandler)
    {
        this.aeron = Objects.requireNonNull(aeron, "aeron");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.streamId = streamId;
        this.connectTimeoutMs = connectTimeoutMs;
        this.offerPolicy = Objects.requireNonNull(offerPolicy, "offerPolicy");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    @Override
    public void publish(final String topic, final DirectBuffer buffer, final int offset, final int length)
    {
        if (closed.get())
        {
            throw new TransportException("substrate is closed");
        }

        final ExpandableArrayBuffer frame = new ExpandableArrayBuffer(TopicEnvelope.MIN_LENGTH + topic.length() + length);
        final int frameLength = TopicEnvelope.encode(frame, 0, topic, buffer, offset, length);

        Publication publication = null;
        try
        {
            publication = aeron.addPublication(channel, streamId);
            awaitConnected(publication, connectTimeoutMs);
            offer(publication, frame, frameLength);
            messagesPublished.incrementAndGet();
        }
        catch (final AeronException ex)
        {
            publishFailures.incrementAndGet();
            throw new TransportException("publish on " + topic + " failed: " + ex.getMessage(), ex);
        }
        catch (final TransportException ex)
        {
            publishFailures.incrementAndGet();
            throw ex;
        }
        finally
        {
            CloseHelper.quietClose(publication);
        }
    }

    @Override
    public TopicSubscription subscribe(final String topic, final TopicListener listener)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(listener, "listener");

        if (closed.get())
        {
            throw new SubscribeException("substrate is closed");
        }

        ensurePolling();

        final Registration registration = new Registration(topic, listener);
        listenersByTopic.computeIfAbsent(topic, (t) -> new CopyOnWriteArrayList<>()).add(registration);
        System.out.println("[Substrate] Subscribed to " + topic);

        return registration;
    }

    @Override
    public void waitForPeers(final long timeoutMs)
    {
        if (closed.get())
        {
            throw new TransportException("substrate is closed");
        }

        try
        {
            ensurePolling();
        }
        catch (final SubscribeException ex)
        {
            throw new TransportException("cannot join " + channel + ": " + ex.getMessage(), ex);
        }

        Publication probe = null;
        try
        {
            probe = aeron.addPublication(channel, streamId);
            awaitConnected(probe, timeoutMs);
            System.out.println("[Substrate] Peer reachable on " + channel + " stream " + streamId);
        }
        catch (final AeronException ex)
        {
            throw new TransportException("peer discovery failed: " + ex.getMessage(), ex);
        }
        finally
        {
            CloseHelper.quietClose(probe);
        }
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true))
        {
            synchronized (this)
            {
                CloseHelper.closeAll(pollerRunner, subscription);
            }
            listenersByTopic.clear();

            System.out.println("[Substrate] Closed. published=" + messagesPublished.get() +
                ", delivered=" + messagesDelivered.get() + ", invalid=" + invalidEnvelopes.get());
        }
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    public long messagesPublished()
    {
        return messagesPublished.get();
    }

    public long publishFailures()
    {
        return publishFailures.get();
    }

    public long messagesDelivered()
    {
        return messagesDelivered.get();
    }

    public long invalidEnvelopes()
    {
        return invalidEnvelopes.get();
    }

    public long listenerErrors()
    {
        return listenerErrors.get();
    }

    private synchronized void ensurePolling()
    {
        if (closed.get())
        {
            throw new SubscribeException("substrate is closed");
        }

        if (null != pollerRunner)
        {
            return;
        }

        try
        {
            subscription = aeron.addSubscription(channel, streamId);
        }
        catch (final AeronException ex)
        {
            throw new SubscribeException("subscription to " + channel + " rejected: " + ex.getMessage(), ex);
        }

        pollerRunner = new AgentRunner(
            new SleepingMillisIdleStrategy(1), errorHandler, null, new Poller(subscription));
        AgentRunner.startOnThread(pollerRunner);
    }

    private void awaitConnected(final Publication publication, final long timeoutMs)
    {
        final IdleStrategy idleStrategy = new SleepingMillisIdleStrategy(1);
        final long deadlineNs = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        while (!publication.isConnected())
        {
            if (System.nanoTime() - deadlineNs >= 0)
            {
                throw new TransportException("no subscriber connected within " + timeoutMs + "ms");
            }

            if (closed.get() || Thread.currentThread().isInterrupted())
            {
                throw new TransportException("interrupted while waiting for a subscriber");
            }

            idleStrategy.idle();
        }
    }

    private void offer(final Publication publication, final DirectBuffer frame, final int frameLength)
    {
        int attempt = 0;
        while (true)
        {
            attempt++;
            final long result = publication.offer(frame, 0, frameLength);

            if (result > 0)
            {
                return;
            }

            if (Publication.CLOSED == result || Publication.MAX_POSITION_EXCEEDED == result)
            {
                throw new TransportException("publication unusable, offer returned " + result);
            }

            // BACK_PRESSURED, NOT_CONNECTED and ADMIN_ACTION are worth another attempt
            if (!offerPolicy.shouldRetry(attempt))
            {
                throw new TransportException("offer failed after " + attempt + " attempts, last result " + result);
            }

            try
            {
                Thread.sleep(offerPolicy.calculateDelayMs(attempt));
            }
            catch (final InterruptedException ex)
            {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted during offer retry", ex);
            }
        }
    }

    private void dispatch(final TopicEnvelope envelope)
    {
        final List<Registration> registrations = listenersByTopic.get(envelope.topic());
        if (null == registrations)
        {
            return;
        }

        for (final Registration registration : registrations)
        {
            try
            {
                messagesDelivered.incrementAndGet();
                registration.listener.onMessage(
                    envelope.topic(), envelope.buffer(), envelope.payloadOffset(), envelope.payloadLength());
            }
            catch (final Exception ex)
            {
                listenerErrors.incrementAndGet();
                errorHandler.onError(ex);
            }
        }
    }

    private final class Poller implements Agent
    {
        private final Subscription subscription;
        private final TopicEnvelope envelope = new TopicEnvelope();
        private final FragmentAssembler assembler = new FragmentAssembler(this::onFragment);

        Poller(final Subscription subscription)
        {
            this.subscription = subscription;
        }

        @Override
        public int doWork()
        {
            return subscription.poll(assembler, FRAGMENT_LIMIT);
        }

        @Override
        public String roleName()
        {
            return "rfq-substrate-poller";
        }

        private void onFragment(final DirectBuffer buffer, final int offset, final int length, final Header header)
        {
            if (!envelope.wrap(buffer, offset, length))
            {
                invalidEnvelopes.incrementAndGet();
                System.err.println("[Substrate] Dropped invalid envelope of " + length + " bytes");
                return;
            }

            dispatch(envelope);
        }
    }

    private final class Registration implements TopicSubscription
    {
        private final String topic;
        private final TopicListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(final String topic, final TopicListener listener)
        {
            this.topic = topic;
            this.listener = listener;
        }

        @Override
        public String topic()
        {
            return topic;
        }

        @Override
        public boolean isActive()
        {
            return active.get() && !closed.get();
        }

        @Override
        public void close()
        {
            if (active.compareAndSet(true, false))
            {
                final List<Registration> registrations = listenersByTopic.get(topic);
                if (null != registrations)
                {
                    registrations.remove(this);
                }
            }
        }
    }
}
