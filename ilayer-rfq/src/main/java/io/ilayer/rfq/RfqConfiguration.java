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

/**
 * Configuration constants and accessors for RFQ nodes.
 * <p>
 * Every value is read from a system property on each call and falls back to the documented default,
 * so tests and launch scripts can override any of them with {@code -D}.
 * <p>
 * <b>Assumptions:</b>
 * <ul>
 *   <li>All content topics share one Aeron channel and stream; topics are carried in the message
 *       envelope, not mapped to streams</li>
 *   <li>The default multicast channel reaches every requester and solver on the segment</li>
 *   <li>Stream ID 3001 avoids conflicts with default Aeron samples (1001-1003)</li>
 * </ul>
 */
public final class RfqConfiguration
{
    /**
     * Role a node plays.
     */
    public enum Mode
    {
        /** Send the sample request and print the quote */
        REQUESTER,

        /** Price incoming requests until shutdown */
        SOLVER,

        /** Run a solver and a requester in one process */
        BOTH;

        /**
         * Parse a command line value, case insensitive.
         *
         * @param value e.g. {@code solver}.
         * @return the mode.
         * @throws IllegalArgumentException if unknown.
         */
        public static Mode parse(final String value)
        {
            for (final Mode mode : values())
            {
                if (mode.name().equalsIgnoreCase(value))
                {
                    return mode;
                }
            }

            throw new IllegalArgumentException("Unknown mode: " + value);
        }
    }

    // ========================================================================
    // System Property Names
    // ========================================================================

    /** System property for the shared Aeron channel URI */
    public static final String CHANNEL_PROP = "rfq.channel";

    /** System property for the shared Aeron stream ID */
    public static final String STREAM_ID_PROP = "rfq.stream.id";

    /** System property to enable/disable the embedded media driver */
    public static final String EMBEDDED_DRIVER_PROP = "rfq.embedded.driver";

    /** System property for the Aeron directory, empty for the Aeron default */
    public static final String AERON_DIR_PROP = "rfq.aeron.dir";

    /** System property for the delay between subscribe attempts in milliseconds */
    public static final String SUBSCRIBE_RETRY_MS_PROP = "rfq.subscribe.retry.ms";

    /** System property for how long to wait for a reachable peer in milliseconds */
    public static final String PEER_WAIT_TIMEOUT_MS_PROP = "rfq.peer.wait.timeout.ms";

    /** System property for how long a transient publication may take to connect in milliseconds */
    public static final String PUBLISH_CONNECT_TIMEOUT_MS_PROP = "rfq.publish.connect.timeout.ms";

    /** System property for how long a requester waits for a quote in milliseconds */
    public static final String RESPONSE_TIMEOUT_MS_PROP = "rfq.response.timeout.ms";

    /** System property for the price feed endpoint */
    public static final String PRICE_FEED_URL_PROP = "rfq.price.feed.url";

    /** System property for the price feed request timeout in milliseconds */
    public static final String PRICE_FEED_TIMEOUT_MS_PROP = "rfq.price.feed.timeout.ms";

    /** System property for the lower bound of the solver fee */
    public static final String FEE_MIN_PROP = "rfq.fee.min";

    /** System property for the upper bound of the solver fee */
    public static final String FEE_MAX_PROP = "rfq.fee.max";

    /** System property for the number of solver pricing threads */
    public static final String SOLVER_WORKERS_PROP = "rfq.solver.workers";

    // ========================================================================
    // Default Values
    // ========================================================================

    /**
     * Default shared channel.
     * <p>
     * <b>Assumption:</b> multicast on the local segment. Processes sharing one media driver can use
     * {@code aeron:ipc} instead.
     */
    public static final String DEFAULT_CHANNEL = "aeron:udp?endpoint=224.0.1.1:40456|interface=localhost";

    /** Default shared stream ID */
    public static final int DEFAULT_STREAM_ID = 3001;

    /** Default: use embedded media driver for simplicity */
    public static final boolean DEFAULT_EMBEDDED_DRIVER = true;

    /** Default delay between subscribe attempts */
    public static final long DEFAULT_SUBSCRIBE_RETRY_MS = 3_000;

    /** Default time to wait for a peer */
    public static final long DEFAULT_PEER_WAIT_TIMEOUT_MS = 30_000;

    /** Default time for a transient publication to connect */
    public static final long DEFAULT_PUBLISH_CONNECT_TIMEOUT_MS = 5_000;

    /** Default time a requester waits for a quote */
    public static final long DEFAULT_RESPONSE_TIMEOUT_MS = 30_000;

    /** Default price feed endpoint */
    public static final String DEFAULT_PRICE_FEED_URL =
        "https://api.coingecko.com/api/v3/simple/token_price/ethereum";

    /** Default price feed request timeout */
    public static final long DEFAULT_PRICE_FEED_TIMEOUT_MS = 10_000;

    /** Default lower fee bound, 0.1% */
    public static final double DEFAULT_FEE_MIN = 0.001;

    /** Default upper fee bound, 1% */
    public static final double DEFAULT_FEE_MAX = 0.01;

    /** Default number of solver pricing threads */
    public static final int DEFAULT_SOLVER_WORKERS = 4;

    private RfqConfiguration()
    {
    }

    // ========================================================================
    // Configuration Accessor Methods
    // ========================================================================

    /**
     * Get the shared Aeron channel URI.
     *
     * @return the channel URI from system property or default
     */
    public static String channel()
    {
        final String channel = System.getProperty(CHANNEL_PROP);
        if (null != channel && !channel.isEmpty())
        {
            return channel;
        }

        return DEFAULT_CHANNEL;
    }

    public static int streamId()
    {
        return Integer.getInteger(STREAM_ID_PROP, DEFAULT_STREAM_ID);
    }

    /**
     * Check if embedded media driver is enabled.
     * <p>
     * When false the client connects to an external driver in {@link #aeronDir()}.
     *
     * @return true if embedded driver should be used
     */
    public static boolean embeddedDriver()
    {
        return Boolean.parseBoolean(System.getProperty(EMBEDDED_DRIVER_PROP, String.valueOf(DEFAULT_EMBEDDED_DRIVER)));
    }

    /**
     * Get the Aeron directory.
     *
     * @return the directory, or null to use the Aeron default.
     */
    public static String aeronDir()
    {
        final String dir = System.getProperty(AERON_DIR_PROP);
        return null == dir || dir.isEmpty() ? null : dir;
    }

    public static long subscribeRetryMs()
    {
        return Long.getLong(SUBSCRIBE_RETRY_MS_PROP, DEFAULT_SUBSCRIBE_RETRY_MS);
    }

    public static long peerWaitTimeoutMs()
    {
        return Long.getLong(PEER_WAIT_TIMEOUT_MS_PROP, DEFAULT_PEER_WAIT_TIMEOUT_MS);
    }

    public static long publishConnectTimeoutMs()
    {
        return Long.getLong(PUBLISH_CONNECT_TIMEOUT_MS_PROP, DEFAULT_PUBLISH_CONNECT_TIMEOUT_MS);
    }

    public static long responseTimeoutMs()
    {
        return Long.getLong(RESPONSE_TIMEOUT_MS_PROP, DEFAULT_RESPONSE_TIMEOUT_MS);
    }

    public static String priceFeedUrl()
    {
        return System.getProperty(PRICE_FEED_URL_PROP, DEFAULT_PRICE_FEED_URL);
    }

    public static long priceFeedTimeoutMs()
    {
        return Long.getLong(PRICE_FEED_TIMEOUT_MS_PROP, DEFAULT_PRICE_FEED_TIMEOUT_MS);
    }

    public static double feeMin()
    {
        return Double.parseDouble(System.getProperty(FEE_MIN_PROP, String.valueOf(DEFAULT_FEE_MIN)));
    }

    public static double feeMax()
    {
        return Double.parseDouble(System.getProperty(FEE_MAX_PROP, String.valueOf(DEFAULT_FEE_MAX)));
    }

    public static int solverWorkers()
    {
        return Integer.getInteger(SOLVER_WORKERS_PROP, DEFAULT_SOLVER_WORKERS);
    }
}
