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

/**
 * A request that cannot be quoted at all. The solver must not respond to it.
 */
public class PricingException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Why the quote failed.
     */
    public enum Kind
    {
        /** The request has no source token to value */
        NO_SOURCE_TOKEN,

        /** The price feed has no usable price for the source token */
        MISSING_SOURCE_PRICE
    }

    private final Kind kind;

    public PricingException(final Kind kind, final String message)
    {
        super(message);
        this.kind = kind;
    }

    public Kind kind()
    {
        return kind;
    }
}
