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

import io.aeron.Aeron;
import io.aeron.driver.MediaDriver;
import io.ilayer.rfq.codec.QuoteRequest;
import io.ilayer.rfq.codec.QuoteResponse;
import io.ilayer.rfq.codec.SwapSide;
import io.ilayer.rfq.codec.TokenWeight;
import io.ilayer.rfq.identity.SessionIdentity;
import io.ilayer.rfq.pricing.CoinGeckoPriceFeed;
import io.ilayer.rfq.pricing.PricingEngine;
import io.ilayer.rfq.pricing.UniformFeeModel;
import io.ilayer.rfq.resilience.RetryPolicy;
import io.ilayer.rfq.transport.AeronMessagingSubstrate;
import org.agrona.CloseHelper;
import org.agrona.ErrorHandler;
import org.agrona.concurrent.ShutdownSignalBarrier;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point running a solver, a requester or both.
 * <p>
 * <b>Supported Modes:</b>
 * <table border="1">
 *   <tr><th>Mode</th><th>Description</th></tr>
 *   <tr><td>requester</td><td>Send the sample request, print the quote and exit</td></tr>
 *   <tr><td>solver</td><td>Price requests until a shutdown signal</td></tr>
 *   <tr><td>both</td><td>Solver and requester in one process, then keep solving</td></tr>
 * </table>
 * <p>
 * <b>Usage Examples:</b>
 * <pre>
 * java -Drfq.channel=aeron:ipc io.ilayer.rfq.RfqNode --mode=both
 * java io.ilayer.rfq.RfqNode --mode solver
 * </pre>
 * All other settings come from system properties, see {@link RfqConfiguration}.
 */
public final class RfqNode
{
    /** Wrapped ether on mainnet */
    public static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    /** USD Coin */
    public static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    /** Tether USD */
    public static final String USDT = "0xdac17f958d2ee523a2206206994597c13d831ec7";

    static final ErrorHandler ERROR_HANDLER = (throwable) ->
    {
        System.err.println("[RfqNode] Callback failed: " + throwable);
        throwable.printStackTrace(System.err);
    };

    private RfqNode()
    {
    }

    /**
     * Main entry point.
     *
     * @param args {@code --mode requester|solver|both}, defaults to solver.
     * @throws Exception if startup fails.
     */
    public static void main(final String[] args) throws Exception
    {
        final RfqConfiguration.Mode mode = parseMode(args);

        System.out.println("[RfqNode] =====================================");
        System.out.println("[RfqNode] iLayer RFQ node");
        System.out.println("[RfqNode] Mode: " + mode);
        System.out.println("[RfqNode] Channel: " + RfqConfiguration.channel());
        System.out.println("[RfqNode] Stream ID: " + RfqConfiguration.streamId());
        System.out.println("[RfqNode] =====================================");

        final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        final ExecutorService workers = Executors.newFixedThreadPool(RfqConfiguration.solverWorkers());
        final RetryPolicy subscribePolicy = RetryPolicy.unbounded(RfqConfiguration.subscribeRetryMs());

        MediaDriver mediaDriver = null;
        Aeron aeron = null;
        AeronMessagingSubstrate substrate = null;
        RfqSolver solver = null;
        RfqRequester requester = null;

        try
        {
            mediaDriver = launchMediaDriver();
            aeron = Aeron.connect(aeronContext(mediaDriver));
            substrate = new AeronMessagingSubstrate(
                aeron,
                RfqConfiguration.channel(),
                RfqConfiguration.streamId(),
                RfqConfiguration.publishConnectTimeoutMs(),
                AeronMessagingSubstrate.DEFAULT_OFFER_POLICY,
                ERROR_HANDLER);

            if (RfqConfiguration.Mode.REQUESTER != mode)
            {
                final PricingEngine pricingEngine = new PricingEngine(
                    CoinGeckoPriceFeed.create(RfqConfiguration.priceFeedUrl(), RfqConfiguration.priceFeedTimeoutMs()),
                    new UniformFeeModel(RfqConfiguration.feeMin(), RfqConfiguration.feeMax()));

                solver = new RfqSolver(
                    RfqSession.create(SessionIdentity.generate(), substrate),
                    pricingEngine,
                    workers,
                    subscribePolicy,
                    scheduler,
                    RfqConfiguration.peerWaitTimeoutMs());
                solver.start();
            }

            if (RfqConfiguration.Mode.SOLVER != mode)
            {
                requester = new RfqRequester(
                    RfqSession.create(SessionIdentity.generate(), substrate),
                    QuoteResponseListener.PRINTING,
                    subscribePolicy,
                    scheduler,
                    RfqConfiguration.peerWaitTimeoutMs());
                requester.start();
                requestSampleQuote(requester, RfqConfiguration.responseTimeoutMs());
            }

            if (null != solver)
            {
                System.out.println("[RfqNode] Solver running, press Ctrl+C to stop");
                new ShutdownSignalBarrier().await();
            }
        }
        finally
        {
            CloseHelper.closeAll(requester, solver);
            scheduler.shutdownNow();
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
            CloseHelper.closeAll(substrate, aeron, mediaDriver);
            System.out.println("[RfqNode] Shutdown complete");
        }
    }

    /**
     * The demonstration request: 1 WETH on mainnet into 30% USDC and 70% USDT on base.
     *
     * @param requester requester whose bucket the request carries.
     * @return the request.
     */
    public static QuoteRequest sampleRequest(final RfqRequester requester)
    {
        return requester.newRequest(
            new SwapSide<>("mainnet", List.of(new TokenWeight(WETH, 1))),
            new SwapSide<>("base", List.of(new TokenWeight(USDC, 30), new TokenWeight(USDT, 70))));
    }

    static RfqConfiguration.Mode parseMode(final String[] args)
    {
        for (int i = 0; i < args.length; i++)
        {
            final String arg = args[i];
            if (arg.startsWith("--mode="))
            {
                return RfqConfiguration.Mode.parse(arg.substring("--mode=".length()));
            }

            if ("--mode".equals(arg))
            {
                if (i + 1 >= args.length)
                {
                    throw new IllegalArgumentException("--mode requires a value: requester, solver or both");
                }

                return RfqConfiguration.Mode.parse(args[i + 1]);
            }
        }

        return RfqConfiguration.Mode.SOLVER;
    }

    private static void requestSampleQuote(final RfqRequester requester, final long timeoutMs) throws InterruptedException
    {
        final QuoteRequest request = sampleRequest(requester);

        try
        {
            final QuoteResponse response = requester.requestQuote(request, timeoutMs).get();
            System.out.println("[RfqNode] Best quote from " + response.solver() + ": " + response.to());
        }
        catch (final ExecutionException ex)
        {
            System.err.println("[RfqNode] Quote failed: " + ex.getCause().getMessage());
        }
    }

    private static MediaDriver launchMediaDriver()
    {
        if (!RfqConfiguration.embeddedDriver())
        {
            return null;
        }

        final MediaDriver.Context context = new MediaDriver.Context()
            .dirDeleteOnStart(true)
            .dirDeleteOnShutdown(true);

        final String aeronDir = RfqConfiguration.aeronDir();
        if (null != aeronDir)
        {
            context.aeronDirectoryName(aeronDir);
            return MediaDriver.launch(context);
        }

        return MediaDriver.launchEmbedded(context);
    }

    private static Aeron.Context aeronContext(final MediaDriver mediaDriver)
    {
        final Aeron.Context context = new Aeron.Context();

        if (null != mediaDriver)
        {
            context.aeronDirectoryName(mediaDriver.aeronDirectoryName());
        }
        else if (null != RfqConfiguration.aeronDir())
        {
            context.aeronDirectoryName(RfqConfiguration.aeronDir());
        }

        return context;
    }
}
