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
 * No response arrived for an outstanding request within the allowed time.
 */
public class QuoteTimeoutException extends RuntimeException
{
    private static final long serialVersionUID = 2750813914250930712L;

    private final String bucket;
    private final long timeoutMs;

    public QuoteTimeoutException(final String bucket, final long timeoutMs)
    {
        super("no quote for bucket " + bucket + " within " + timeoutMs + "ms");
        this.bucket = bucket;
        this.timeoutMs = timeoutMs;
    }

    public String bucket()
    {
        return bucket;
    }

    public long timeoutMs()
    {
        return timeoutMs;
    }
}
