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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a {@link QuoteRequest} into priced destination amounts.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Look up prices for every address on both sides.</li>
 *   <li>{@code sourceValue = from.tokens[0].weight * price(from.tokens[0])}. The source weight is an
 *       absolute quantity, unlike destination weights.</li>
 *   <li>Per destination token: {@code value = sourceValue * weight / 100},
 *       {@code quantity = value / price}, {@code amount = quantity * (1 - fee)} with a fee drawn per
 *       token. Weights are not normalised across tokens.</li>
 * </ol>
 * A destination token without a price is quoted as {@code 0} and the others are unaffected. A source
 * token without a price fails the whole quote with a {@link PricingException}.
 * <p>
 * <b>Thread Safety:</b> safe for concurrent use provided the {@link PriceFeed} and {@link FeeModel}
 * are. The engine keeps no state between calls other than counters.
 */
public final class PricingEngine
{
    private final PriceFeed priceFeed;
    private final FeeModel feeModel;
    private final AtomicLong quotesComputed = new AtomicLong();
    private final AtomicLong missingSourcePrices = new AtomicLong();
    private final AtomicLong missingDestinationPrices = new AtomicLong();

    public PricingEngine(final PriceFeed priceFeed, final FeeModel feeModel)
    {
        this.priceFeed = Objects.requireNonNull(priceFeed, "priceFeed");
        this.feeModel = Objects.requireNonNull(feeModel, "feeModel");
    }

    /**
     * Addresses of all tokens in a request: source tokens then destination tokens, duplicates kept.
     *
     * @param request the request.
     * @return addresses in request order.
     */
    public static List<String> extractAddresses(final QuoteRequest request)
    {
        final List<String> addresses = new ArrayList<>(request.from().tokens().size() + request.to().tokens().size());

        for (final TokenWeight token : request.from().tokens())
        {
            addresses.add(token.address());
        }

        for (final TokenWeight token : request.to().tokens())
        {
            addresses.add(token.address());
        }

        return addresses;
    }

    /**
     * Find the price of an address, ignoring case.
     * <p>
     * A zero or negative price is not a usable price and is reported as unknown.
     *
     * @param prices  prices from the feed.
     * @param address address to look up.
     * @return the price, or {@link Double#NaN} if unknown.
     */
    public static double priceOf(final List<Price> prices, final String address)
    {
        for (final Price price : prices)
        {
            if (price.isFor(address))
            {
                return price.price() > 0.0 ? price.price() : Double.NaN;
            }
        }

        return Double.NaN;
    }

    /**
     * Quote a request.
     *
     * @param request  the request to price.
     * @param solverId public key of the solver, carried in the response.
     * @return the response to send back.
     * @throws PricingException if the request has no source token or the source price is unknown.
     */
    public QuoteResponse quote(final QuoteRequest request, final String solverId)
    {
        final List<TokenWeight> fromTokens = request.from().tokens();
        if (fromTokens.isEmpty())
        {
            throw new PricingException(PricingException.Kind.NO_SOURCE_TOKEN, "Request has no source token");
        }

        final List<Price> prices = priceFeed.lookup(extractAddresses(request));
        final TokenWeight fromToken = fromTokens.get(0);
        final double fromTokenPrice = priceOf(prices, fromToken.address());

        if (Double.isNaN(fromTokenPrice))
        {
            missingSourcePrices.incrementAndGet();
            throw new PricingException(
                PricingException.Kind.MISSING_SOURCE_PRICE, "Price not found for " + fromToken.address());
        }

        final double sourceValue = fromToken.weight() * fromTokenPrice;
        final List<TokenAmount> toTokens = computeDestinationAmounts(request.to().tokens(), sourceValue, prices);

        final List<TokenAmount> echoed = new ArrayList<>(fromTokens.size());
        for (final TokenWeight token : fromTokens)
        {
            echoed.add(new TokenAmount(token.address(), token.weight()));
        }

        quotesComputed.incrementAndGet();

        return new QuoteResponse(
            solverId,
            new SwapSide<>(request.from().network(), echoed),
            new SwapSide<>(request.to().network(), toTokens));
    }

    /**
     * Price each destination token independently.
     *
     * @param toTokens    destination tokens with percentage weights.
     * @param sourceValue USD value of the source side.
     * @param prices      prices from the feed.
     * @return amounts after fee, one per destination token in the same order.
     */
    public List<TokenAmount> computeDestinationAmounts(
        final List<TokenWeight> toTokens, final double sourceValue, final List<Price> prices)
    {
        final List<TokenAmount> amounts = new ArrayList<>(toTokens.size());

        for (final TokenWeight toToken : toTokens)
        {
            final double toTokenPrice = priceOf(prices, toToken.address());

            if (Double.isNaN(toTokenPrice))
            {
                missingDestinationPrices.incrementAndGet();
                System.err.println("[Pricing] Price not found for " + toToken.address() + ", quoting 0");
                amounts.add(new TokenAmount(toToken.address(), 0));
                continue;
            }

            final double toTokenValue = sourceValue * toToken.weight() / 100;
            final double toTokenAmount = toTokenValue / toTokenPrice;
            final double fee = feeModel.nextFee();

            amounts.add(new TokenAmount(toToken.address(), toTokenAmount * (1 - fee)));
        }

        return amounts;
    }

    public long quotesComputed()
    {
        return quotesComputed.get();
    }

    public long missingSourcePrices()
    {
        return missingSourcePrices.get();
    }

    public long missingDestinationPrices()
    {
        return missingDestinationPrices.get();
    }
}
