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
package io.ilayer.rfq;

import io.ilayer.rfq.codec.CodecException;
import io.ilayer.rfq.codec.QuoteCodec;
import io.ilayer.rfq.codec.QuoteRequest;
import io.ilayer.rfq.codec.QuoteResponse;
import io.ilayer.rfq.codec.SwapSide;
import io.ilayer.rfq.codec.TokenAmount;
import io.ilayer.rfq.codec.TokenWeight;
import io.ilayer.rfq.resilience.RetryPolicy;
import io.ilayer.rfq.subscription.SubscriptionManager;
import io.ilayer.rfq.transport.TransportException;
import org.agrona.DirectBuffer;
import org.agrona.ExpandableArrayBuffer;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Requesting side of the RFQ exchange.
 * <p>
 * <b>Lifecycle:</b>
 * <ol>
 *   <li>{@link #start()} waits for a reachable peer and subscribes to the session's response topic</li>
 *   <li>{@link #sendRequest(QuoteRequest)} or {@link #requestQuote(QuoteRequest, long)} publish on
 *       the request topic</li>
 *   <li>Responses for the session bucket arrive on the poller thread, go to the
 *       {@link QuoteResponseListener} and complete the outstanding quote, if any</li>
 * </ol>
 * At most one {@link #requestQuote(QuoteRequest, long)} may be outstanding. The first response that
 * answers it, same networks and same token addresses in order, completes it. Responses to an older
 * request and any after the first still reach the listener and are counted as discarded.
 */
public final class RfqRequester implements AutoCloseable
{
    private final RfqSession session;
    private final QuoteResponseListener responseListener;
    private final ScheduledExecutorService scheduler;
    private final long peerWaitTimeoutMs;
    private final SubscriptionManager subscriptionManager;
    private final AtomicReference<PendingQuote> lastQuote = new AtomicReference<>();
    private volatile boolean started;

    private final AtomicLong requestsSent = new AtomicLong();
    private final AtomicLong responsesReceived = new AtomicLong();
    private final AtomicLong malformedResponses = new AtomicLong();
    private final AtomicLong discardedResponses = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();

    /**
     * @param session           session of this process.
     * @param responseListener  receives every decoded response.
     * @param subscribePolicy   retry policy for the response subscription.
     * @param scheduler         runs subscription retries and quote timeouts, owned by the caller.
     * @param peerWaitTimeoutMs how long {@link #start()} waits for a peer and for the subscription.
     */
    public RfqRequester(
        final RfqSession session,
        final QuoteResponseListener responseListener,
        final RetryPolicy subscribePolicy,
        final ScheduledExecutorService scheduler,
        final long peerWaitTimeoutMs)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.responseListener = Objects.requireNonNull(responseListener, "responseListener");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.peerWaitTimeoutMs = peerWaitTimeoutMs;
        this.subscriptionManager = new SubscriptionManager(
            "Requester", session.substrate(), session.responseTopic(), this::onResponse, subscribePolicy, scheduler);
    }

    /**
     * Wait for peers, then subscribe to the response topic. Returns once the subscription is live.
     *
     * @throws TransportException if no peer is reachable or the subscription is not live in time.
     */
    public void start()
    {
        System.out.println("[Requester] Starting, bucket=" + session.bucket() + ", listening on " +
            session.responseTopic());

        session.substrate().waitForPeers(peerWaitTimeoutMs);
        subscriptionManager.start();

        try
        {
            if (!subscriptionManager.awaitSubscribed(peerWaitTimeoutMs, TimeUnit.MILLISECONDS))
            {
                throw new TransportException("response subscription not live within " + peerWaitTimeoutMs + "ms");
            }
        }
        catch (final InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while subscribing", ex);
        }

        started = true;
    }

    /**
     * Build a request carrying this session's bucket.
     *
     * @param from source side, weights are absolute quantities.
     * @param to   destination side, weights are percentages of the source value.
     * @return the request.
     */
    public QuoteRequest newRequest(final SwapSide<TokenWeight> from, final SwapSide<TokenWeight> to)
    {
        return new QuoteRequest(session.bucket(), from, to);
    }

    /**
     * Publish a request once. There is no acknowledgement and no retry.
     *
     * @param request request carrying this session's bucket.
     * @throws IllegalStateException    if not started.
     * @throws IllegalArgumentException if the request carries another bucket.
     * @throws TransportException       if the substrate could not take the message.
     */
    public void sendRequest(final QuoteRequest request)
    {
        if (!started)
        {
            throw new IllegalStateException("requester not started");
        }

        if (!session.bucket().equals(request.bucket()))
        {
            throw new IllegalArgumentException(
                "request bucket " + request.bucket() + " does not belong to this session (" + session.bucket() + ")");
        }

        final ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(256);
        final int length = QuoteCodec.encodeRequest(buffer, 0, request);
        session.substrate().publish(session.requestTopic(), buffer, 0, length);
        requestsSent.incrementAndGet();

        System.out.println("[Requester] Request sent: " + request);
    }

    /**
     * Send a request and wait asynchronously for its first response.
     *
     * @param request   request carrying this session's bucket.
     * @param timeoutMs how long to wait for a response.
     * @return future completed with the first response answering the request, or exceptionally with
     * {@link QuoteTimeoutException} or the send failure.
     * @throws IllegalStateException if another quote is still outstanding.
     */
    public CompletableFuture<QuoteResponse> requestQuote(final QuoteRequest request, final long timeoutMs)
    {
        final CompletableFuture<QuoteResponse> future = new CompletableFuture<>();
        final PendingQuote previous = lastQuote.get();
        if ((null != previous && !previous.future.isDone()) ||
            !lastQuote.compareAndSet(previous, new PendingQuote(request, future)))
        {
            throw new IllegalStateException("a quote request is already outstanding");
        }

        final ScheduledFuture<?> timer = scheduler.schedule(
            () ->
            {
                if (future.completeExceptionally(new QuoteTimeoutException(session.bucket(), timeoutMs)))
                {
                    timeouts.incrementAndGet();
                    System.err.println("[Requester] No quote within " + timeoutMs + "ms");
                }
            },
            timeoutMs,
            TimeUnit.MILLISECONDS);

        future.whenComplete((response, error) -> timer.cancel(false));

        try
        {
            sendRequest(request);
        }
        catch (final RuntimeException ex)
        {
            future.completeExceptionally(ex);
        }

        return future;
    }

    /**
     * Stop listening and cancel the outstanding quote, if any.
     */
    @Override
    public void close()
    {
        started = false;
        subscriptionManager.close();

        final PendingQuote pending = lastQuote.get();
        if (null != pending)
        {
            pending.future.cancel(false);
        }
    }

    public RfqSession session()
    {
        return session;
    }

    public SubscriptionManager subscriptionManager()
    {
        return subscriptionManager;
    }

    public long requestsSent()
    {
        return requestsSent.get();
    }

    public long responsesReceived()
    {
        return responsesReceived.get();
    }

    public long malformedResponses()
    {
        return malformedResponses.get();
    }

    public long discardedResponses()
    {
        return discardedResponses.get();
    }

    public long timeouts()
    {
        return timeouts.get();
    }

    private void onResponse(final String topic, final DirectBuffer buffer, final int offset, final int length)
    {
        final QuoteResponse response;
        try
        {
            response = QuoteCodec.decodeResponse(buffer, offset, length);
        }
        catch (final CodecException ex)
        {
            malformedResponses.incrementAndGet();
            System.err.println("[Requester] Dropped malformed response on " + topic + ": " + ex.getMessage());
            return;
        }

        responsesReceived.incrementAndGet();

        final PendingQuote pending = lastQuote.get();
        if (null != pending)
        {
            if (!pending.isAnsweredBy(response))
            {
                discardedResponses.incrementAndGet();
                System.out.println("[Requester] Discarded response from " + response.solver() +
                    ", it does not answer the last quote request");
            }
            else if (!pending.future.complete(response))
            {
                discardedResponses.incrementAndGet();
                System.out.println("[Requester] Discarded response from " + response.solver() +
                    ", quote already completed");
            }
        }

        responseListener.onResponse(response);
    }

    private static final class PendingQuote
    {
        private final QuoteRequest request;
        private final CompletableFuture<QuoteResponse> future;

        PendingQuote(final QuoteRequest request, final CompletableFuture<QuoteResponse> future)
        {
            this.request = request;
            this.future = future;
        }

        boolean isAnsweredBy(final QuoteResponse response)
        {
            return sameSide(request.from(), response.from()) && sameSide(request.to(), response.to());
        }

        private static boolean sameSide(final SwapSide<TokenWeight> asked, final SwapSide<TokenAmount> quoted)
        {
            if (!asked.network().equals(quoted.network()) || asked.tokens().size() != quoted.tokens().size())
            {
                return false;
            }

            for (int i = 0; i < asked.tokens().size(); i++)
            {
                if (!asked.tokens().get(i).address().equalsIgnoreCase(quoted.tokens().get(i).address()))
                {
                    return false;
                }
            }

            return true;
        }
    }
}
