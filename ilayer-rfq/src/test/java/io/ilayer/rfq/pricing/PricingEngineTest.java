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
package io.ilayer.rfq.pricing;

import io.ilayer.rfq.codec.QuoteRequest;
import io.ilayer.rfq.codec.QuoteResponse;
import io.ilayer.rfq.codec.SwapSide;
import io.ilayer.rfq.codec.TokenAmount;
import io.ilayer.rfq.codec.TokenWeight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PricingEngine}.
 * <p>
 * Prices come from a fixed map and the fee is forced to zero unless a test is about fees, so every
 * expected amount can be written down exactly.
 */
@DisplayName("PricingEngine Unit Tests")
class PricingEngineTest
{
    private static final String SOLVER = "0x02c6047f9441ed7d6d3045406e95c07cd85c778e4b8cef3ca7abac09b95c709ee5";

    static PriceFeed feedOf(final Map<String, Double> prices)
    {
        return (addresses) ->
        {
            final List<Price> result = new ArrayList<>();
            for (final String address : addresses)
            {
                final Double price = prices.get(address.toLowerCase());
                if (null != price)
                {
                    result.add(new Price(address.toLowerCase(), price));
                }
            }

            return result;
        };
    }

    static QuoteRequest request(final List<TokenWeight> from, final List<TokenWeight> to)
    {
        return new QuoteRequest("ab12cd34", new SwapSide<>("mainnet", from), new SwapSide<>("base", to));
    }

    @Nested
    @DisplayName("Quote Computation Tests")
    class QuoteComputationTests
    {
        @Test
        @DisplayName("should price 1000 @1 into 30% @2 and 70% @5")
        void shouldPriceConcreteScenario()
        {
            final PricingEngine engine = new PricingEngine(
                feedOf(Map.of("0xaaa", 1.0, "0xbbb", 2.0, "0xccc", 5.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xAAA", 1000)),
                    List.of(new TokenWeight("0xBBB", 30), new TokenWeight("0xCCC", 70))),
                SOLVER);

            assertEquals(
                List.of(new TokenAmount("0xBBB", 150), new TokenAmount("0xCCC", 140)),
                response.to().tokens());
            assertEquals(SOLVER, response.solver());
            assertEquals("base", response.to().network());
            assertEquals(1, engine.quotesComputed());
        }

        @Test
        @DisplayName("should give W * Ps / Pd for a single destination at weight 100")
        void shouldConvertWholeSourceValue()
        {
            final double[][] cases = { { 1, 1, 1 }, { 2.5, 1800, 0.5 }, { 0.25, 64_000, 3200 }, { 10, 3, 7 } };

            for (final double[] c : cases)
            {
                final double weight = c[0];
                final double sourcePrice = c[1];
                final double destinationPrice = c[2];
                final PricingEngine engine = new PricingEngine(
                    feedOf(Map.of("0xaaa", sourcePrice, "0xbbb", destinationPrice)), FeeModel.NONE);

                final QuoteResponse response = engine.quote(
                    request(List.of(new TokenWeight("0xaaa", weight)), List.of(new TokenWeight("0xbbb", 100))),
                    SOLVER);

                assertEquals(weight * sourcePrice / destinationPrice, response.to().tokens().get(0).amount(), 1e-9);
            }
        }

        @Test
        @DisplayName("should echo source weights as amounts")
        void shouldEchoSourceSide()
        {
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xaaa", 3.0, "0xbbb", 1.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xaaa", 4), new TokenWeight("0xddd", 9)),
                    List.of(new TokenWeight("0xbbb", 50))),
                SOLVER);

            assertEquals("mainnet", response.from().network());
            assertEquals(
                List.of(new TokenAmount("0xaaa", 4), new TokenAmount("0xddd", 9)),
                response.from().tokens());
        }

        @Test
        @DisplayName("should price only from the first source token")
        void shouldUseFirstSourceTokenOnly()
        {
            final PricingEngine engine = new PricingEngine(
                feedOf(Map.of("0xaaa", 2.0, "0xddd", 1_000.0, "0xbbb", 1.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xaaa", 5), new TokenWeight("0xddd", 5)),
                    List.of(new TokenWeight("0xbbb", 100))),
                SOLVER);

            assertEquals(10.0, response.to().tokens().get(0).amount());
        }

        @Test
        @DisplayName("should not normalise destination weights")
        void shouldNotNormaliseWeights()
        {
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xaaa", 1.0, "0xbbb", 1.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xaaa", 100)),
                    List.of(new TokenWeight("0xbbb", 80), new TokenWeight("0xbbb", 80))),
                SOLVER);

            assertEquals(80.0, response.to().tokens().get(0).amount());
            assertEquals(80.0, response.to().tokens().get(1).amount());
        }

        @Test
        @DisplayName("should match prices regardless of address case")
        void shouldMatchAddressesIgnoringCase()
        {
            final PriceFeed upperCaseFeed = (addresses) -> List.of(new Price("0xAAA", 4.0), new Price("0xBBB", 2.0));
            final PricingEngine engine = new PricingEngine(upperCaseFeed, FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(List.of(new TokenWeight("0xaaa", 1)), List.of(new TokenWeight("0xbbb", 100))), SOLVER);

            assertEquals(2.0, response.to().tokens().get(0).amount());
        }

        @Test
        @DisplayName("should apply a fee drawn per destination token")
        void shouldApplyFeePerToken()
        {
            final double[] fees = { 0.01, 0.005 };
            final int[] draws = { 0 };
            final FeeModel feeModel = () -> fees[draws[0]++];
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xaaa", 1.0, "0xbbb", 1.0)), feeModel);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xaaa", 100)),
                    List.of(new TokenWeight("0xbbb", 50), new TokenWeight("0xbbb", 50))),
                SOLVER);

            assertEquals(2, draws[0]);
            assertEquals(50 * 0.99, response.to().tokens().get(0).amount(), 1e-12);
            assertEquals(50 * 0.995, response.to().tokens().get(1).amount(), 1e-12);
        }

        @Test
        @DisplayName("should keep amounts within the default fee bounds")
        void shouldStayWithinDefaultFeeBounds()
        {
            final PricingEngine engine = new PricingEngine(
                feedOf(Map.of("0xaaa", 1.0, "0xbbb", 1.0)), new UniformFeeModel(0.001, 0.01));

            for (int i = 0; i < 200; i++)
            {
                final double amount = engine.quote(
                    request(List.of(new TokenWeight("0xaaa", 1000)), List.of(new TokenWeight("0xbbb", 100))),
                    SOLVER).to().tokens().get(0).amount();

                assertTrue(amount <= 1000 * (1 - 0.001) && amount > 1000 * (1 - 0.01), String.valueOf(amount));
            }
        }
    }

    @Nested
    @DisplayName("Missing Price Tests")
    class MissingPriceTests
    {
        @Test
        @DisplayName("should quote zero for a destination without price and leave the others alone")
        void shouldQuoteZeroForMissingDestinationPrice()
        {
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xaaa", 1.0, "0xccc", 5.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(
                    List.of(new TokenWeight("0xaaa", 1000)),
                    List.of(new TokenWeight("0xbbb", 30), new TokenWeight("0xccc", 70))),
                SOLVER);

            assertEquals(
                List.of(new TokenAmount("0xbbb", 0), new TokenAmount("0xccc", 140)),
                response.to().tokens());
            assertEquals(1, engine.missingDestinationPrices());
        }

        @Test
        @DisplayName("should treat a zero price as unknown")
        void shouldTreatZeroPriceAsUnknown()
        {
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xaaa", 1.0, "0xbbb", 0.0)), FeeModel.NONE);

            final QuoteResponse response = engine.quote(
                request(List.of(new TokenWeight("0xaaa", 1)), List.of(new TokenWeight("0xbbb", 100))), SOLVER);

            assertEquals(0.0, response.to().tokens().get(0).amount());
        }

        @Test
        @DisplayName("should fail when the source price is missing")
        void shouldFailWithoutSourcePrice()
        {
            final PricingEngine engine = new PricingEngine(feedOf(Map.of("0xbbb", 1.0)), FeeModel.NONE);

            final PricingException ex = assertThrows(
                PricingException.class,
                () -> engine.quote(
                    request(List.of(new TokenWeight("0xaaa", 1)), List.of(new TokenWeight("0xbbb", 100))), SOLVER));

            assertEquals(PricingException.Kind.MISSING_SOURCE_PRICE, ex.kind());
            assertEquals(1, engine.missingSourcePrices());
            assertEquals(0, engine.quotesComputed());
        }

        @Test
        @DisplayName("should fail without a source token and without asking the feed")
        void shouldFailWithoutSourceToken()
        {
            final PriceFeed priceFeed = mock(PriceFeed.class);
            final PricingEngine engine = new PricingEngine(priceFeed, FeeModel.NONE);

            final PricingException ex = assertThrows(
                PricingException.class,
                () -> engine.quote(request(List.of(), List.of(new TokenWeight("0xbbb", 100))), SOLVER));

            assertEquals(PricingException.Kind.NO_SOURCE_TOKEN, ex.kind());
            verify(priceFeed, never()).lookup(anyList());
        }
    }

    @Nested
    @DisplayName("Address Extraction Tests")
    class AddressExtractionTests
    {
        @Test
        @DisplayName("should list source then destination addresses, keeping duplicates")
        void shouldExtractInOrderWithDuplicates()
        {
            final QuoteRequest request = request(
                List.of(new TokenWeight("0xaaa", 1), new TokenWeight("0xbbb", 1)),
                List.of(new TokenWeight("0xbbb", 50), new TokenWeight("0xccc", 50)));

            assertEquals(List.of("0xaaa", "0xbbb", "0xbbb", "0xccc"), PricingEngine.extractAddresses(request));
        }

        @Test
        @DisplayName("should ask the feed once with every address")
        void shouldLookUpOnce()
        {
            final PriceFeed priceFeed = mock(PriceFeed.class);
            when(priceFeed.lookup(anyList())).thenReturn(List.of(new Price("0xaaa", 1.0), new Price("0xbbb", 1.0)));
            final PricingEngine engine = new PricingEngine(priceFeed, FeeModel.NONE);

            engine.quote(request(List.of(new TokenWeight("0xaaa", 1)), List.of(new TokenWeight("0xbbb", 100))), SOLVER);

            verify(priceFeed, times(1)).lookup(List.of("0xaaa", "0xbbb"));
        }

        @Test
        @DisplayName("should report NaN for an unknown address")
        void shouldReportUnknownPriceAsNaN()
        {
            final List<Price> prices = List.of(new Price("0xaaa", 2.0), new Price("0xbbb", -1.0));

            assertEquals(2.0, PricingEngine.priceOf(prices, "0xAAA"));
            assertTrue(Double.isNaN(PricingEngine.priceOf(prices, "0xbbb")));
            assertTrue(Double.isNaN(PricingEngine.priceOf(prices, "0xccc")));
        }
    }
}
