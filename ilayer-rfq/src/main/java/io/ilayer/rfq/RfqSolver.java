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
import io.ilayer.rfq.identity.Buckets;
import io.ilayer.rfq.identity.Topics;
import io.ilayer.rfq.pricing.PricingEngine;
import io.ilayer.rfq.pricing.PricingException;
import io.ilayer.rfq.resilience.RetryPolicy;
import io.ilayer.rfq.subscription.SubscriptionManager;
import io.ilayer.rfq.transport.TransportException;
import org.agrona.DirectBuffer;
import org.agrona.ExpandableArrayBuffer;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solving side of the RFQ exchange.
 * <p>
 * Requests are decoded and checked on the substrate's poller thread, then priced and answered on
 * the worker {@link Executor} so a slow price feed never stalls delivery. Each response is published
 * once on the requester's bucket topic.
 * <p>
 * A request is dropped, with an error line and a counter, when it cannot be decoded, carries an
 * invalid bucket, cannot be priced or its response cannot be published. None of these stop the
 * solver.
 */
public final class RfqSolver implements AutoCloseable
{
    private final RfqSession session;
    private final PricingEngine pricingEngine;
    private final Executor workers;
    private final long peerWaitTimeoutMs;
    private final SubscriptionManager subscriptionManager;

    private final AtomicLong requestsReceived = new AtomicLong();
    private final AtomicLong malformedRequests = new AtomicLong();
    private final AtomicLong invalidBuckets = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();
    private final AtomicLong pricingFailures = new AtomicLong();
    private final AtomicLong encodeFailures = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong responsesSent = new AtomicLong();

    /**
     * @param session           session of this process, its public key is the solver id.
     * @param pricingEngine     prices requests.
     * @param workers           runs pricing and publishing, owned by the caller.
     * @param subscribePolicy   retry policy for the request subscription.
     * @param scheduler         runs subscription retries, owned by the caller.
     * @param peerWaitTimeoutMs how long {@link #start()} waits for a peer.
     */
    public RfqSolver(
        final RfqSession session,
        final PricingEngine pricingEngine,
        final Executor workers,
        final RetryPolicy subscribePolicy,
        final ScheduledExecutorService scheduler,
        final long peerWaitTimeoutMs)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.pricingEngine = Objects.requireNonNull(pricingEngine, "pricingEngine");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.peerWaitTimeoutMs = peerWaitTimeoutMs;
        this.subscriptionManager = new SubscriptionManager(
            "Solver", session.substrate(), session.requestTopic(), this::onRequest, subscribePolicy, scheduler);
    }

    /**
     * Wait for peers and subscribe to the request topic. A failed subscription is retried in the
     * background.
     *
     * @throws TransportException if no peer is reachable in time.
     */
    public void start()
    {
        System.out.println("[Solver] Starting, id=" + session.publicKey() + ", listening on " + session.requestTopic());

        session.substrate().waitForPeers(peerWaitTimeoutMs);
        subscriptionManager.start();
    }

    /**
     * Price a request into the response to send back.
     *
     * @param request a decoded request.
     * @return the response, solver id set to this session's public key.
     * @throws PricingException if the request cannot be priced.
     */
    public QuoteResponse processMessage(final QuoteRequest request)
    {
        return pricingEngine.quote(request, session.publicKey());
    }

    @Override
    public void close()
    {
        subscriptionManager.close();
        System.out.println("[Solver] Closed. received=" + requestsReceived.get() + ", sent=" + responsesSent.get() +
            ", pricingFailures=" + pricingFailures.get() + ", publishFailures=" + publishFailures.get());
    }

    public RfqSession session()
    {
        return session;
    }

    public SubscriptionManager subscriptionManager()
    {
        return subscriptionManager;
    }

    public long requestsReceived()
    {
        return requestsReceived.get();
    }

    public long malformedRequests()
    {
        return malformedRequests.get();
    }

    public long invalidBuckets()
    {
        return invalidBuckets.get();
    }

    public long rejectedRequests()
    {
        return rejectedRequests.get();
    }

    public long pricingFailures()
    {
        return pricingFailures.get();
    }

    public long encodeFailures()
    {
        return encodeFailures.get();
    }

    public long publishFailures()
    {
        return publishFailures.get();
    }

    public long responsesSent()
    {
        return responsesSent.get();
    }

    private void onRequest(final String topic, final DirectBuffer buffer, final int offset, final int length)
    {
        final QuoteRequest request;
        try
        {
            request = QuoteCodec.decodeRequest(buffer, offset, length);
        }
        catch (final CodecException ex)
        {
            malformedRequests.incrementAndGet();
            System.err.println("[Solver] Dropped malformed request: " + ex.getMessage());
            return;
        }

        if (!Buckets.isValid(request.bucket()))
        {
            invalidBuckets.incrementAndGet();
            System.err.println("[Solver] Dropped request with invalid bucket: " + request.bucket());
            return;
        }

        requestsReceived.incrementAndGet();

        try
        {
            workers.execute(() -> respond(request));
        }
        catch (final RejectedExecutionException ex)
        {
            rejectedRequests.incrementAndGet();
            System.err.println("[Solver] Dropped request for bucket " + request.bucket() + ", workers unavailable");
        }
    }

    private void respond(final QuoteRequest request)
    {
        final QuoteResponse response;
        try
        {
            response = processMessage(request);
        }
        catch (final PricingException ex)
        {
            pricingFailures.incrementAndGet();
            System.err.println("[Solver] Cannot price request for bucket " + request.bucket() + ": " +
                ex.kind() + " " + ex.getMessage());
            return;
        }

        final String responseTopic = Topics.topicFor(request.bucket());
        final ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(256);
        final int length;
        try
        {
            length = QuoteCodec.encodeResponse(buffer, 0, response);
        }
        catch (final RuntimeException ex)
        {
            encodeFailures.incrementAndGet();
            System.err.println("[Solver] Cannot encode quote for bucket " + request.bucket() + ": " + ex.getMessage());
            return;
        }

        try
        {
            session.substrate().publish(responseTopic, buffer, 0, length);
            responsesSent.incrementAndGet();
            System.out.println("[Solver] Quote sent on " + responseTopic + ": " + response);
        }
        catch (final TransportException ex)
        {
            publishFailures.incrementAndGet();
            System.err.println("[Solver] Failed to publish quote on " + responseTopic + ": " + ex.getMessage());
        }
    }
}
