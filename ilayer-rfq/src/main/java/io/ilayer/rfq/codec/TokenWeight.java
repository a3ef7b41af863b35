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
 * Participation weight of one token on one side of a requested swap.
 * <p>
 * The meaning of {@link #weight()} depends on the side: for the first source token it is an absolute
 * quantity, for destination tokens it is a percentage share of the source value.
 */
public final class TokenWeight
{
    private final String address;
    private final double weight;

    /**
     * Create a token weight.
     *
     * @param address token contract address.
     * @param weight  quantity or percentage share, see class docs.
     */
    public TokenWeight(final String address, final double weight)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.weight = weight;
    }

    public String address()
    {
        return address;
    }

    public double weight()
    {
        return weight;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof TokenWeight))
        {
            return false;
        }

        final TokenWeight that = (TokenWeight)o;
        return Double.compare(weight, that.weight) == 0 && address.equals(that.address);
    }

    @Override
    public int hashCode()
    {
        return 31 * address.hashCode() + Double.hashCode(weight);
    }

    @Override
    public String toString()
    {
        return "{address=" + address + ", weight=" + weight + '}';
    }
}
