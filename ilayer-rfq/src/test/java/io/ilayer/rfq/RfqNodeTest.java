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

import io.ilayer.rfq.codec.QuoteRequest;
import io.ilayer.rfq.codec.TokenWeight;
import io.ilayer.rfq.identity.SessionIdentity;
import io.ilayer.rfq.resilience.RetryPolicy;
import io.ilayer.rfq.transport.LoopbackSubstrate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class RfqNodeTest
{
    @Test
    void shouldDefaultToSolverMode()
    {
        assertEquals(RfqConfiguration.Mode.SOLVER, RfqNode.parseMode(new String[0]));
    }

    @Test
    void shouldParseModeInBothForms()
    {
        assertEquals(RfqConfiguration.Mode.REQUESTER, RfqNode.parseMode(new String[]{ "--mode=requester" }));
        assertEquals(RfqConfiguration.Mode.BOTH, RfqNode.parseMode(new String[]{ "--mode", "both" }));
    }

    @Test
    void shouldRejectMissingModeValue()
    {
        assertThrows(IllegalArgumentException.class, () -> RfqNode.parseMode(new String[]{ "--mode" }));
    }

    @Test
    void shouldBuildSampleRequestForRequesterBucket()
    {
        final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (RfqRequester requester = new RfqRequester(
            RfqSession.create(SessionIdentity.generate(), new LoopbackSubstrate()),
            QuoteResponseListener.PRINTING,
            RetryPolicy.unbounded(100),
            scheduler,
            1_000))
        {
            final QuoteRequest request = RfqNode.sampleRequest(requester);

            assertEquals(requester.session().bucket(), request.bucket());
            assertEquals("mainnet", request.from().network());
            assertEquals(List.of(new TokenWeight(RfqNode.WETH, 1)), request.from().tokens());
            assertEquals("base", request.to().network());
            assertEquals(
                List.of(new TokenWeight(RfqNode.USDC, 30), new TokenWeight(RfqNode.USDT, 70)),
                request.to().tokens());
        }
        finally
        {
            scheduler.shutdownNow();
        }
    }
}
