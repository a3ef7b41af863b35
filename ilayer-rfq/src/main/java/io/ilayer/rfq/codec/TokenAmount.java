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
 * Computed quantity of a token in a quote response.
 */
public final class TokenAmount
{
    private final String address;
    private final double amount;

    public TokenAmount(final String address, final double amount)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.amount = amount;
    }

    public String address()
    {
        return address;
    }

    public double amount()
    {
        return amount;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof TokenAmount))
        {
            return false;
        }

        final TokenAmount that = (TokenAmount)o;
        return Double.compare(amount, that.amount) == 0 && address.equals(that.address);
    }

    @Override
    public int hashCode()
    {
        return 31 * address.hashCode() + Double.hashCode(amount);
    }

    @Override
    public String toString()
    {
        return "{address=" + address + ", amount=" + amount + '}';
    }
}
