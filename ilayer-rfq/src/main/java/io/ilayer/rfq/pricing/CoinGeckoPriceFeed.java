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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ilayer.rfq.resilience.RetryPolicy;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PriceFeed} backed by the CoinGecko token price endpoint.
 * <p>
 * One GET per address, issued sequentially:
 * {@code <baseUrl>?contract_addresses=<address>&vs_currencies=usd}. The body is an object keyed by the
 * lower case contract address, e.g. {@code {"0xc02a...":{"usd":3150.2}}}.
 * <p>
 * A failed lookup for one address is logged and the address is left out of the result, which the
 * {@link PricingEngine} treats as an unknown price. HTTP 429 is retried according to the
 * {@link RetryPolicy}; other non-2xx statuses are not.
 */
public final class CoinGeckoPriceFeed implements PriceFeed
{
    /** HTTP status returned when rate limited */
    public static final int TOO_MANY_REQUESTS = 429;

    /** Default policy for rate limited lookups */
    public static final RetryPolicy DEFAULT_RATE_LIMIT_POLICY = RetryPolicy.exponentialWithJitter(3, 1_000, 8_000, 0.3);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final RetryPolicy rateLimitPolicy;
    private final AtomicLong lookupFailures = new AtomicLong();
    private final AtomicLong rateLimitRetries = new AtomicLong();

    public CoinGeckoPriceFeed(
        final HttpClient httpClient,
        final ObjectMapper objectMapper,
        final String baseUrl,
        final Duration requestTimeout,
        final RetryPolicy rateLimitPolicy)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.rateLimitPolicy = Objects.requireNonNull(rateLimitPolicy, "rateLimitPolicy");
    }

    /**
     * Create a feed with its own {@link HttpClient} using the same timeout for connect and request.
     *
     * @param baseUrl   endpoint, without query string.
     * @param timeoutMs connect and request timeout in milliseconds.
     * @return the feed.
     */
    public static CoinGeckoPriceFeed create(final String baseUrl, final long timeoutMs)
    {
        final Duration timeout = Duration.ofMillis(timeoutMs);
        final HttpClient client = HttpClient.newBuilder().connectTimeout(timeout).build();

        return new CoinGeckoPriceFeed(client, new ObjectMapper(), baseUrl, timeout, DEFAULT_RATE_LIMIT_POLICY);
    }

    @Override
    public List<Price> lookup(final List<String> addresses)
    {
        final List<Price> prices = new ArrayList<>(addresses.size());

        for (final String address : addresses)
        {
            try
            {
                final Price price = fetch(address);
                if (null != price)
                {
                    prices.add(price);
                }
            }
            catch (final IOException ex)
            {
                lookupFailures.incrementAndGet();
                System.err.println("[PriceFeed] Lookup failed for " + address + ": " + ex);
            }
            catch (final InterruptedException ex)
            {
                Thread.currentThread().interrupt();
                System.err.println("[PriceFeed] Interrupted, returning " + prices.size() + " price(s)");
                break;
            }
        }

        return prices;
    }

    private Price fetch(final String address) throws IOException, InterruptedException
    {
        final HttpRequest request = HttpRequest.newBuilder(uriFor(address))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        int attempt = 0;
        while (true)
        {
            attempt++;
            final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            final int status = response.statusCode();

            if (TOO_MANY_REQUESTS == status && rateLimitPolicy.shouldRetry(attempt))
            {
                rateLimitRetries.incrementAndGet();
                final long delayMs = rateLimitPolicy.calculateDelayMs(attempt);
                System.err.println("[PriceFeed] Rate limited on " + address + ", retrying in " + delayMs + "ms");
                Thread.sleep(delayMs);
                continue;
            }

            if (status < 200 || status >= 300)
            {
                lookupFailures.incrementAndGet();
                System.err.println("[PriceFeed] HTTP " + status + " for " + address);
                return null;
            }

            return parse(address, response.body());
        }
    }

    Price parse(final String address, final String body) throws IOException
    {
        final JsonNode root = objectMapper.readTree(body);
        if (null == root || !root.isObject())
        {
            throw new IOException("unexpected body: " + body);
        }

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext())
        {
            final Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(address))
            {
                final JsonNode usd = entry.getValue().get("usd");
                if (null != usd && usd.isNumber())
                {
                    return new Price(entry.getKey().toLowerCase(Locale.ROOT), usd.doubleValue());
                }
            }
        }

        System.err.println("[PriceFeed] No usd price for " + address);
        return null;
    }

    private URI uriFor(final String address)
    {
        return URI.create(
            baseUrl + "?contract_addresses=" + URLEncoder.encode(address, StandardCharsets.UTF_8) +
            "&vs_currencies=usd");
    }

    public long lookupFailures()
    {
        return lookupFailures.get();
    }

    public long rateLimitRetries()
    {
        return rateLimitRetries.get();
    }
}
