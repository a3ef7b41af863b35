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
package io.ilayer.rfq.identity;

/**
 * Content topic names shared by requesters and solvers.
 * <p>
 * Topic layout: {@code /<namespace>/<version>/<bucket>/<format>}. The request topic uses the literal
 * {@link #REQUEST_SEGMENT} in place of a bucket. These strings are visible on the wire and must not
 * change between deployments.
 */
public final class Topics
{
    /** Protocol namespace segment */
    public static final String NAMESPACE = "iLayer";

    /** Protocol version segment */
    public static final int VERSION = 1;

    /** Format segment */
    public static final String FORMAT = "proto";

    /** Segment used instead of a bucket for the well-known request topic */
    public static final String REQUEST_SEGMENT = "rfq";

    /** Well-known topic every solver listens on */
    public static final String REQUEST_TOPIC = format(REQUEST_SEGMENT);

    private Topics()
    {
    }

    /**
     * Response topic for a bucket.
     *
     * @param bucket the requester's bucket.
     * @return the topic the solver publishes the response on.
     * @throws IllegalArgumentException if the bucket is not valid.
     * @see Buckets#isValid(String)
     */
    public static String topicFor(final String bucket)
    {
        if (!Buckets.isValid(bucket))
        {
            throw new IllegalArgumentException("invalid bucket: " + bucket);
        }

        return format(bucket);
    }

    private static String format(final String segment)
    {
        return "/" + NAMESPACE + "/" + VERSION + "/" + segment + "/" + FORMAT;
    }
}
