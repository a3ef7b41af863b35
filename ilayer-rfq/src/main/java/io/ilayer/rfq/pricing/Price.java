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

import java.util.Locale;
import java.util.Objects;

/**
 * Spot price of a token in USD.
 */
public final class Price
{
    private final String address;
    private final double price;

    public Price(final String address, final double price)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.price = price;
    }

    public String address()
    {
        return address;
    }

    public double price()
    {
        return price;
    }

    /**
     * Case insensitive address match.
     *
     * @param otherAddress address to compare with.
     * @return true if both refer to the same token.
     */
    public boolean isFor(final String otherAddress)
    {
        return null != otherAddress && address.toLowerCase(Locale.ROOT).equals(otherAddress.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof Price))
        {
            return false;
        }

        final Price that = (Price)o;
        return Double.compare(price, that.price) == 0 && address.equals(that.address);
    }

    @Override
    public int hashCode()
    {
        return 31 * address.hashCode() + Double.hashCode(price);
    }

    @Override
    public String toString()
    {
        return "Price{address=" + address + ", price=" + price + '}';
    }
}
