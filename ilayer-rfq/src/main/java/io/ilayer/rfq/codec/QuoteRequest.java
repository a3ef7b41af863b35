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
package io.ilayer.rfq.codec;

import java.util.Objects;

/**
 * Self-contained description of a desired swap, broadcast by a requester on the request topic.
 * <p>
 * The {@link #bucket()} is the only link between this request and its response: the solver publishes
 * on the topic derived from it.
 */
public final class QuoteRequest
{
    private final String bucket;
    private final SwapSide<TokenWeight> from;
    private final SwapSide<TokenWeight> to;

    public QuoteRequest(final String bucket, final SwapSide<TokenWeight> from, final SwapSide<TokenWeight> to)
    {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public String bucket()
    {
        return bucket;
    }

    public SwapSide<TokenWeight> from()
    {
        return from;
    }

    public SwapSide<TokenWeight> to()
    {
        return to;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof QuoteRequest))
        {
            return false;
        }

        final QuoteRequest that = (QuoteRequest)o;
        return bucket.equals(that.bucket) && from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(bucket, from, to);
    }

    @Override
    public String toString()
    {
        return "QuoteRequest{bucket=" + bucket + ", from=" + from + ", to=" + to + '}';
    }
}
